package crm.sync.app.config;

import crm.sync.app.entity.User;
import crm.sync.app.service.UserService;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.web.authentication.SimpleUrlAuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Creates or updates the local user after a Google login. Provider integrations are
 * connected separately through the integrations API, not through the login tokens.
 */
@Slf4j
@Component
public class OAuth2SuccessHandler extends SimpleUrlAuthenticationSuccessHandler {
    private final UserService userService;

    public OAuth2SuccessHandler(UserService userService) {
        this.userService = userService;
        setDefaultTargetUrl("/api/integrations");
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException, ServletException {
        if (authentication instanceof OAuth2AuthenticationToken) {
            User user = userService.getOrCreateUser(authentication);
            log.info("User {} logged in", user.getId());
        }
        super.onAuthenticationSuccess(request, response, authentication);
    }
}
