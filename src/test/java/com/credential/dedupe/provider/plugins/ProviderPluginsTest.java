package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.MissingRequiredColumnException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Built-in provider plugin Tests")
class ProviderPluginsTest {

    @Nested
    @DisplayName("Proton Pass")
    class ProtonPass {

        private final ProtonPassPlugin plugin = new ProtonPassPlugin();

        private Map<String, String> baseRow() {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : ProtonPassPlugin.IMPORT_COLUMNS) {
                row.put(column, "");
            }
            return row;
        }

        @Test
        @DisplayName("Maps the canonical columns")
        void mapsColumns() {
            Map<String, String> row = baseRow();
            row.put("type", "login");
            row.put("name", "GitHub");
            row.put("url", "https://github.com");
            row.put("email", "alice@example.com");
            row.put("username", "alice");
            row.put("password", "pw");
            row.put("note", "n");
            row.put("totp", "otpauth://totp/GitHub?secret=ABC");
            row.put("createTime", "1700000000");
            row.put("modifyTime", "2023-11-14T22:15:00Z");
            row.put("vault", "Personal");

            VaultItem item = plugin.importRow(row);

            assertEquals(ItemType.LOGIN, item.getItemType());
            assertEquals("protonpass", item.getSource());
            assertEquals("GitHub", item.getTitle());
            assertEquals("https://github.com", item.getPrimaryUrl());
            assertEquals("alice@example.com", item.getEmail());
            assertEquals("alice", item.getUsername());
            assertEquals("otpauth://totp/GitHub?secret=ABC", item.getTotpUri());
            assertNull(item.getTotpSecret());
            assertEquals(1_700_000_000_000L, item.getCreatedAt());
            assertEquals(1_700_000_100_000L, item.getUpdatedAt());
            assertEquals("Personal", item.getFolder());
        }

        @Test
        @DisplayName("A raw TOTP secret goes to totpSecret")
        void rawSecret() {
            Map<String, String> row = baseRow();
            row.put("totp", "JBSWY3DPEHPK3PXP");

            VaultItem item = plugin.importRow(row);

            assertNull(item.getTotpUri());
            assertEquals("JBSWY3DPEHPK3PXP", item.getTotpSecret());
        }

        @Test
        @DisplayName("Maps Proton item types")
        void mapsTypes() {
            Map<String, String> row = baseRow();
            row.put("type", "creditCard");
            assertEquals(ItemType.CARD, plugin.importRow(row).getItemType());

            row.put("type", "note");
            assertEquals(ItemType.NOTE, plugin.importRow(row).getItemType());

            row.put("type", "alias");
            assertEquals(ItemType.OTHER, plugin.importRow(row).getItemType());
        }

        @Test
        @DisplayName("Unparsable timestamps become absent, not errors")
        void unparsableTimestamp() {
            Map<String, String> row = baseRow();
            row.put("modifyTime", "last tuesday");

            assertNull(plugin.importRow(row).getUpdatedAt());
        }

        @Test
        @DisplayName("Unknown columns are kept verbatim in extra and not exported")
        void unknownColumnsPreserved() {
            Map<String, String> row = baseRow();
            row.put("passkeys", "[]");

            VaultItem item = plugin.importRow(row);

            assertEquals("[]", item.getExtra().get("passkeys"));
            assertFalse(plugin.exportRow(item).containsKey("passkeys"));
        }

        @Test
        @DisplayName("A missing required column names the column")
        void missingColumn() {
            Map<String, String> row = baseRow();
            row.remove("vault");

            MissingRequiredColumnException e = assertThrows(MissingRequiredColumnException.class,
                    () -> plugin.importRow(row));
            assertEquals("vault", e.getColumn());
            assertEquals("protonpass", e.getProviderId());
        }

        @Test
        @DisplayName("Column lookup tolerates a byte-order mark, spacing and case")
        void tolerantLookup() {
            Map<String, String> row = new HashMap<>(baseRow());
            row.remove("type");
            row.put("\uFEFFType ", "note");
            row.remove("name");
            row.put("NAME", "Wifi");

            VaultItem item = plugin.importRow(row);

            assertEquals(ItemType.NOTE, item.getItemType());
            assertEquals("Wifi", item.getTitle());
            assertFalse(item.getExtra().containsKey("\uFEFFType "));
            assertFalse(item.getExtra().containsKey("NAME"));
        }

        @Test
        @DisplayName("Export emits exactly the export columns in order")
        void exportColumns() {
            VaultItem item = VaultItem.builder().title("X").build();

            assertEquals(List.of("name", "url", "email", "username", "password", "note", "totp", "vault"),
                    List.copyOf(plugin.exportRow(item).keySet()));
        }
    }

    @Nested
    @DisplayName("Bitwarden")
    class Bitwarden {

        private final BitwardenPlugin plugin = new BitwardenPlugin();

        @Test
        @DisplayName("Splits login_uri into primary and secondary URLs")
        void splitsUris() {
            VaultItem item = plugin.importRow(Map.of(
                    "type", "login", "name", "Jira",
                    "login_uri", "https://jira.example.com, https://sso.example.com",
                    "favorite", "1"));

            assertEquals("https://jira.example.com", item.getPrimaryUrl());
            assertEquals(List.of("https://sso.example.com"), item.getSecondaryUrls());
            assertTrue(item.isFavorite());
        }

        @Test
        @DisplayName("Only type and name are required")
        void minimalRow() {
            VaultItem item = plugin.importRow(Map.of("type", "card", "name", "Visa"));

            assertEquals(ItemType.CARD, item.getItemType());
            assertNull(item.getPrimaryUrl());
        }

        @Test
        @DisplayName("Exports items from another provider from canonical fields")
        void crossProviderExport() {
            VaultItem item = VaultItem.builder()
                    .source("protonpass")
                    .title("GitHub")
                    .primaryUrl("https://github.com")
                    .addSecondaryUrl("https://gist.github.com")
                    .username("alice")
                    .password("pw")
                    .folder("Dev")
                    .favorite(true)
                    .totpSecret("ABC")
                    .putExtra("email", "alice@example.com")
                    .build();

            Map<String, String> row = plugin.exportRow(item);

            assertEquals("Dev", row.get("folder"));
            assertEquals("1", row.get("favorite"));
            assertEquals("login", row.get("type"));
            assertEquals("https://github.com,https://gist.github.com", row.get("login_uri"));
            assertEquals("ABC", row.get("login_totp"));
            assertEquals("", row.get("fields"));
        }
    }

    @Nested
    @DisplayName("LastPass")
    class LastPass {

        private final LastPassPlugin plugin = new LastPassPlugin();

        @Test
        @DisplayName("Secure notes become note items without a URL")
        void secureNote() {
            VaultItem item = plugin.importRow(Map.of("url", "http://sn", "username", "", "password", "",
                    "extra", "text", "name", "Note"));

            assertEquals(ItemType.NOTE, item.getItemType());
            assertNull(item.getPrimaryUrl());
            assertEquals("text", item.getNotes());
        }

        @Test
        @DisplayName("grouping becomes the folder and fav=1 a favorite")
        void folderAndFavorite() {
            VaultItem item = plugin.importRow(Map.of("url", "https://a.com", "username", "u", "password", "p",
                    "grouping", "Shopping", "fav", "1"));

            assertEquals("Shopping", item.getFolder());
            assertTrue(item.isFavorite());
        }
    }

    @Nested
    @DisplayName("NordPass")
    class NordPass {

        private final NordPassPlugin plugin = new NordPassPlugin();

        @Test
        @DisplayName("Infers cards and identities from filled columns")
        void infersType() {
            Map<String, String> card = new HashMap<>(Map.of("name", "Visa", "url", "", "username", "",
                    "password", "", "cardnumber", "4111111111111111"));
            Map<String, String> identity = new HashMap<>(Map.of("name", "Me", "url", "", "username", "",
                    "password", "", "full_name", "Jane Doe"));
            Map<String, String> login = new HashMap<>(Map.of("name", "Site", "url", "https://a.com",
                    "username", "u", "password", "p"));

            assertEquals(ItemType.CARD, plugin.importRow(card).getItemType());
            assertEquals(ItemType.IDENTITY, plugin.importRow(identity).getItemType());
            assertEquals(ItemType.LOGIN, plugin.importRow(login).getItemType());
            assertEquals("4111111111111111", plugin.importRow(card).getExtra().get("cardnumber"));
        }
    }

    @Nested
    @DisplayName("Firefox")
    class Firefox {

        private final FirefoxPlugin plugin = new FirefoxPlugin();

        @Test
        @DisplayName("guid becomes the source id and password change time the update time")
        void identityAndTimes() {
            VaultItem item = plugin.importRow(Map.of("url", "https://a.com", "username", "u", "password", "p",
                    "guid", "{abc}", "timeCreated", "1600000000000", "timeLastUsed", "1700000500000",
                    "timePasswordChanged", "1700000000000"));

            assertEquals("{abc}", item.getSourceId());
            assertEquals(1_600_000_000_000L, item.getCreatedAt());
            assertEquals(1_700_000_000_000L, item.getUpdatedAt());
        }

        @Test
        @DisplayName("Falls back to last-used time when the password never changed")
        void lastUsedFallback() {
            VaultItem item = plugin.importRow(Map.of("url", "https://a.com", "username", "u", "password", "p",
                    "timeLastUsed", "1700000500000"));

            assertEquals(1_700_000_500_000L, item.getUpdatedAt());
        }

        @Test
        @DisplayName("Does not export a foreign source id as guid")
        void foreignGuid() {
            VaultItem item = VaultItem.builder().source("bitwarden").sourceId("xyz").updatedAt(5L).build();

            Map<String, String> row = plugin.exportRow(item);

            assertEquals("", row.get("guid"));
            assertEquals("5", row.get("timePasswordChanged"));
        }
    }

    @Nested
    @DisplayName("Dashlane")
    class Dashlane {

        @Test
        @DisplayName("Email column feeds the email field")
        void email() {
            VaultItem item = new DashlanePlugin().importRow(Map.of("Type", "Login", "Name", "Shop",
                    "Website URL", "shop.com", "Password", "p", "Email", "d@shop.com"));

            assertEquals("d@shop.com", item.getEmail());
            assertEquals("", item.getUsername());
        }
    }

    @Nested
    @DisplayName("Apple Passwords")
    class ApplePasswords {

        @Test
        @DisplayName("OTPAuth becomes the TOTP URI")
        void otpAuth() {
            VaultItem item = new ApplePasswordsPlugin().importRow(Map.of("Title", "t", "URL", "https://a.com",
                    "Username", "u", "Password", "p", "OTPAuth", "otpauth://totp/a?secret=S"));

            assertEquals("otpauth://totp/a?secret=S", item.getTotpUri());
        }
    }
}
