package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MergeNotesBuilder Tests")
class MergeNotesBuilderTest {

    private final MergeNotesBuilder builder = new MergeNotesBuilder();

    @Test
    @DisplayName("Each distinct alternative value is listed once, in first-seen order")
    void listsDistinctAlternatives() {
        VaultItem preferred = VaultItem.builder().title("Example").primaryUrl("https://example.com")
                .username("me").password("current").notes("Main note").build();
        VaultItem second = VaultItem.builder().title("Example").primaryUrl("https://login.example.com")
                .username("me").password("old").build();
        VaultItem third = VaultItem.builder().title("Example").primaryUrl("https://m.example.com")
                .username("me").password("old").build();

        String notes = builder.build(preferred, List.of(preferred, second, third));

        assertEquals("Main note\n\n"
                + "Merged from duplicates:\n"
                + "- Alternative URLs: https://login.example.com, https://m.example.com\n"
                + "- Alternative passwords: old", notes);
    }

    @Test
    @DisplayName("Distinct notes of other members follow the merge block")
    void appendsOtherNotes() {
        VaultItem preferred = VaultItem.builder().title("A").notes("keep").build();
        VaultItem other = VaultItem.builder().title("B").notes("other note").build();
        VaultItem same = VaultItem.builder().title("A").notes("keep").build();

        String notes = builder.build(preferred, List.of(preferred, other, same));

        assertEquals("keep\n\n"
                + "Merged from duplicates:\n"
                + "- Alternative names: B\n\n"
                + "other note", notes);
    }

    @Test
    @DisplayName("Folders of the other members are listed as original vaults")
    void listsOriginalVaults() {
        VaultItem preferred = VaultItem.builder().title("A").folder("Personal").build();
        VaultItem other = VaultItem.builder().title("A").folder("Work").totpSecret("JBSWY3DP").build();

        String notes = builder.build(preferred, List.of(preferred, other));

        assertEquals("Merged from duplicates:\n"
                + "- Alternative TOTP secrets: JBSWY3DP\n"
                + "- Original vaults: Work", notes);
    }

    @Test
    @DisplayName("Nothing to add leaves the preferred notes and record untouched")
    void identicalMembersChangeNothing() {
        VaultItem preferred = VaultItem.builder().title("A").notes("n").build();
        VaultItem copy = VaultItem.builder().title("A").notes("n").build();

        assertEquals("n", builder.build(preferred, List.of(preferred, copy)));
        assertSame(preferred, builder.merge(preferred, List.of(preferred, copy)));
    }

    @Test
    @DisplayName("Merging keeps identity and every non-notes field of the preferred record")
    void mergeKeepsIdentity() {
        VaultItem preferred = VaultItem.builder().source("bitwarden").sourceId("b-1").title("A")
                .password("p1").updatedAt(10L).build();
        VaultItem other = VaultItem.builder().title("A").password("p2").build();

        VaultItem merged = builder.merge(preferred, List.of(preferred, other));

        assertEquals(preferred.getInternalId(), merged.getInternalId());
        assertEquals("bitwarden", merged.getSource());
        assertEquals("b-1", merged.getSourceId());
        assertEquals("p1", merged.getPassword());
        assertEquals(10L, merged.getUpdatedAt());
        assertTrue(merged.getNotes().contains("- Alternative passwords: p2"));
    }
}
