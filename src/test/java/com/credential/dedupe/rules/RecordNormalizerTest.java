package com.credential.dedupe.rules;

import com.credential.dedupe.core.model.VaultItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordNormalizer Tests")
class RecordNormalizerTest {

    @Nested
    @DisplayName("Domain normalization")
    class Domains {

        @ParameterizedTest
        @CsvSource({
                "https://www.Example.com/login, example.com",
                "example.com, example.com",
                "www.example.com/path?q=1, example.com",
                "HTTP://WWW.EXAMPLE.COM:8443/, example.com",
                "https://user:pw@accounts.example.com, accounts.example.com",
                "https://www.www.example.com, www.example.com",
                "//cdn.example.com/x, cdn.example.com",
                "https://example.com., example.com",
                "android://hash@com.example.app/, com.example.app"
        })
        @DisplayName("Extracts a lower-cased host without one leading www")
        void normalizesDomain(String url, String expected) {
            assertEquals(expected, RecordNormalizer.normalizeDomain(url));
        }

        @Test
        @DisplayName("Null and blank URLs have no domain")
        void emptyInput() {
            assertEquals("", RecordNormalizer.normalizeDomain(null));
            assertEquals("", RecordNormalizer.normalizeDomain("   "));
        }
    }

    @Nested
    @DisplayName("domainOrName")
    class DomainOrName {

        @Test
        @DisplayName("Uses the URL domain when present")
        void prefersDomain() {
            VaultItem item = VaultItem.builder().primaryUrl("https://www.github.com").title("GitHub Work").build();
            assertEquals("github.com", RecordNormalizer.domainOrName(item));
        }

        @Test
        @DisplayName("Falls back to the normalized title")
        void fallsBackToTitle() {
            VaultItem item = VaultItem.builder().title("  My   Bank  Login ").build();
            assertEquals("my bank login", RecordNormalizer.domainOrName(item));
        }

        @Test
        @DisplayName("Is empty when neither URL nor title is present")
        void emptyWhenNothing() {
            assertEquals("", RecordNormalizer.domainOrName(VaultItem.builder().build()));
        }
    }

    @Nested
    @DisplayName("loginId")
    class LoginId {

        @Test
        @DisplayName("Username is trimmed and lower-cased")
        void username() {
            VaultItem item = VaultItem.builder().username("  Alice@Example.COM ").build();
            assertEquals("alice@example.com", RecordNormalizer.loginId(item, true));
        }

        @Test
        @DisplayName("Email stands in for an empty username only with equivalence on")
        void emailFallback() {
            VaultItem item = VaultItem.builder().putExtra("email", "User@X.com").build();

            assertEquals("user@x.com", RecordNormalizer.loginId(item, true));
            assertEquals("", RecordNormalizer.loginId(item, false));
        }

        @Test
        @DisplayName("A username wins over the email")
        void usernameWins() {
            VaultItem item = VaultItem.builder().username("alice").putExtra("email", "a@x.com").build();
            assertEquals("alice", RecordNormalizer.loginId(item, true));
        }
    }

    @Test
    @DisplayName("parseTimestamp uses the default chain")
    void parseTimestamp() {
        assertEquals(1_700_000_000_000L, RecordNormalizer.parseTimestamp("1700000000").orElseThrow());
        assertTrue(RecordNormalizer.parseTimestamp("yesterday").isEmpty());
    }
}
