package crm.sync.app.service.provider;

import crm.sync.app.entity.IntegrationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ProviderRegistry {
    private final Map<IntegrationType, ProviderClient> clients = new EnumMap<>(IntegrationType.class);

    public ProviderRegistry(List<ProviderClient> providerClients) {
        for (ProviderClient client : providerClients) {
            ProviderClient previous = clients.put(client.getType(), client);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider client for " + client.getType());
            }
        }
        log.info("Registered provider clients: {}", clients.keySet());
    }

    public ProviderClient get(IntegrationType type) {
        ProviderClient client = clients.get(type);
        if (client == null) {
            throw new IllegalArgumentException("No provider client registered for " + type);
        }
        return client;
    }

    public CalendarProviderClient getCalendar(IntegrationType type) {
        ProviderClient client = get(type);
        if (!(client instanceof CalendarProviderClient)) {
            throw new IllegalArgumentException(type + " is not a calendar provider");
        }
        return (CalendarProviderClient) client;
    }
}
