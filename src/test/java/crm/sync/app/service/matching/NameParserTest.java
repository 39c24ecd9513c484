package crm.sync.app.service.matching;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameParserTest {

    @Test
    void parse_WithDisplayName_ShouldSplitOnFirstSpace() {
        ParsedName name = NameParser.parse("Mary Anne van Dyke", "mary@co.com");

        assertEquals("Mary", name.getFirstName());
        assertEquals("Anne van Dyke", name.getLastName());
    }

    @Test
    void parse_WithSingleWordName_ShouldLeaveLastNameEmpty() {
        ParsedName name = NameParser.parse("Cher", "cher@co.com");

        assertEquals("Cher", name.getFirstName());
        assertNull(name.getLastName());
    }

    @Test
    void parse_WithoutDisplayName_ShouldUseEmailLocalPart() {
        ParsedName name = NameParser.parse(null, "john.o-neil+crm@co.com");

        assertEquals("John", name.getFirstName());
        assertEquals("O Neil", name.getLastName());
    }

    @Test
    void parse_WithAddressAsDisplayName_ShouldUseThatAddress() {
        ParsedName name = NameParser.parse("jane_doe@co.com", "jane_doe@co.com");

        assertEquals("Jane", name.getFirstName());
        assertEquals("Doe", name.getLastName());
    }

    @Test
    void parse_WithNothingUsable_ShouldReturnUnknown() {
        assertEquals("Unknown", NameParser.parse(null, null).getFirstName());
        assertEquals("Unknown", NameParser.parse("  ", "...@co.com").getFirstName());
    }
}
