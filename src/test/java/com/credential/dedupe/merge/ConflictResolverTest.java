package com.credential.dedupe.merge;

import com.credential.dedupe.audit.AuditAction;
import com.credential.dedupe.audit.AuditService;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.grouping.GroupingEngine;
import com.credential.dedupe.grouping.GroupingOptions;
import com.credential.dedupe.provider.plugins.FirefoxPlugin;
import com.credential.dedupe.provider.plugins.NordPassPlugin;
import com.credential.dedupe.review.MemberDifference;
import com.credential.dedupe.review.ReviewCluster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConflictResolver Tests")
class ConflictResolverTest {

    private AuditService auditService;
    private ConflictResolver resolver;
    private final GroupingEngine engine = new GroupingEngine();

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        resolver = new ConflictResolver(auditService);
    }

    private ResolutionResult resolve(List<VaultItem> records, GroupingOptions options) {
        return resolver.resolve(engine.group(records, options));
    }

    private static VaultItem.Builder login() {
        return VaultItem.builder().title("Example").primaryUrl("https://example.com")
                .username("me").password("secret");
    }

    @Nested
    @DisplayName("Exact duplicates")
    class ExactDuplicates {

        @Test
        @DisplayName("Identical content collapses onto the most recently updated record")
        void collapsesOntoLatest() {
            VaultItem older = login().updatedAt(1_000L).build();
            VaultItem newer = login().updatedAt(2_000L).build();

            ResolutionResult result = resolve(List.of(older, newer), GroupingOptions.defaults());

            assertEquals(List.of(newer), result.autoResolvedRecords());
            assertEquals(List.of(older), result.removedExactDuplicates());
            assertFalse(result.hasPendingClusters());
            assertTrue(result.resolvedClusters().get(0).exactDuplicate());

            assertEquals(1, auditService.getEntriesByAction(AuditAction.EXACT_DUPLICATE_REMOVED).size());
            assertEquals(older.getInternalId(),
                    auditService.getEntriesByAction(AuditAction.EXACT_DUPLICATE_REMOVED).get(0).recordId());
        }

        @Test
        @DisplayName("Running resolution on its own output removes nothing more")
        void idempotent() {
            VaultItem a = login().build();
            VaultItem b = login().build();
            VaultItem c = login().primaryUrl("https://other.com").build();

            ResolutionResult first = resolve(List.of(a, b, c), GroupingOptions.defaults());
            ResolutionResult second = resolve(first.autoResolvedRecords(), GroupingOptions.defaults());

            assertEquals(1, first.removedExactDuplicates().size());
            assertTrue(second.removedExactDuplicates().isEmpty());
            assertEquals(first.autoResolvedRecords(), second.autoResolvedRecords());
        }

        @Test
        @DisplayName("A different folder prevents silent removal")
        void folderDifferenceGoesToReview() {
            VaultItem a = login().folder("Work").build();
            VaultItem b = login().folder("Home").build();

            ResolutionResult result = resolve(List.of(a, b), GroupingOptions.defaults());

            assertTrue(result.removedExactDuplicates().isEmpty());
            assertEquals(1, result.pendingClusters().size());
        }
    }

    @Nested
    @DisplayName("Provider columns")
    class ProviderColumns {

        private Map<String, String> nordPassCard(String cardNumber) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("name", "Visa");
            row.put("url", "");
            row.put("username", "");
            row.put("password", "");
            row.put("cardholdername", "J Doe");
            row.put("cardnumber", cardNumber);
            row.put("cvc", "123");
            return row;
        }

        private Map<String, String> firefoxLogin(String timeLastUsed, String timePasswordChanged) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("url", "https://example.com");
            row.put("username", "me");
            row.put("password", "secret");
            row.put("timeLastUsed", timeLastUsed);
            row.put("timePasswordChanged", timePasswordChanged);
            return row;
        }

        @Test
        @DisplayName("Cards differing only by card number go to review instead of being removed")
        void differentCardsAreKept() {
            NordPassPlugin plugin = new NordPassPlugin();
            VaultItem first = plugin.importRow(nordPassCard("4111111111111111"));
            VaultItem second = plugin.importRow(nordPassCard("5500000000000004"));

            ResolutionResult result = resolve(List.of(first, second), GroupingOptions.defaults());

            assertTrue(result.removedExactDuplicates().isEmpty());
            assertEquals(1, result.pendingClusters().size());
            assertEquals(List.of(first, second), result.pendingClusters().get(0).members());
            assertTrue(auditService.getEntriesByAction(AuditAction.EXACT_DUPLICATE_REMOVED).isEmpty());
        }

        @Test
        @DisplayName("Identical cards are still removed as exact duplicates")
        void identicalCardsCollapse() {
            NordPassPlugin plugin = new NordPassPlugin();
            VaultItem first = plugin.importRow(nordPassCard("4111111111111111"));
            VaultItem second = plugin.importRow(nordPassCard("4111111111111111"));

            ResolutionResult result = resolve(List.of(first, second), GroupingOptions.defaults());

            assertEquals(List.of(second), result.removedExactDuplicates());
        }

        @Test
        @DisplayName("Provider timestamp columns do not block exact-duplicate removal")
        void timestampColumnsIgnored() {
            FirefoxPlugin plugin = new FirefoxPlugin();
            VaultItem older = plugin.importRow(firefoxLogin("1700000000000", "1700000000000"));
            VaultItem newer = plugin.importRow(firefoxLogin("1700000500000", "1700000900000"));

            ResolutionResult result = resolve(List.of(older, newer), GroupingOptions.defaults());

            assertEquals(List.of(newer), result.autoResolvedRecords());
            assertEquals(List.of(older), result.removedExactDuplicates());
        }
    }

    @Nested
    @DisplayName("Near duplicates")
    class NearDuplicates {

        @Test
        @DisplayName("Differing content goes to review with nothing discarded")
        void pendingReview() {
            VaultItem a = login().password("old").updatedAt(1L).build();
            VaultItem b = login().password("new").updatedAt(2L).build();

            ResolutionResult result = resolve(List.of(a, b), GroupingOptions.relaxed());

            assertTrue(result.autoResolvedRecords().isEmpty());
            assertTrue(result.removedExactDuplicates().isEmpty());
            ReviewCluster review = result.pendingClusters().get(0);
            assertSame(b, review.preferredCandidate());
            assertEquals(List.of(a), review.alternatives());
            assertTrue(review.proposedMergedNotesPreview().contains("- Alternative passwords: old"));
            assertEquals(Set.of(MemberDifference.PASSWORD, MemberDifference.OLDER),
                    review.differencesOf(a.getInternalId()));
            assertTrue(review.differencesOf(b.getInternalId()).isEmpty());
            assertTrue(review.sharedPasswordWith(a.getInternalId()).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.REVIEW_REQUESTED).size());
        }

        @Test
        @DisplayName("Audit details never carry credential values")
        void auditHasNoSecrets() {
            VaultItem a = login().password("old-secret").build();
            VaultItem b = login().password("new-secret").build();

            resolve(List.of(a, b), GroupingOptions.relaxed());

            assertTrue(auditService.getAllEntries().stream()
                    .flatMap(e -> e.details().values().stream())
                    .noneMatch(v -> v.contains("secret")));
        }
    }

    @Test
    @DisplayName("Review clusters report which members share a password")
    void sharedPasswordsOnReview() {
        VaultItem a = login().password("same").notes("one").build();
        VaultItem b = login().password("same").notes("two").build();
        VaultItem c = login().password("unique").build();

        ReviewCluster review = resolve(List.of(a, b, c), GroupingOptions.relaxed()).pendingClusters().get(0);

        assertEquals(List.of(b.getInternalId()), review.sharedPasswordWith(a.getInternalId()));
        assertEquals(List.of(a.getInternalId()), review.sharedPasswordWith(b.getInternalId()));
        assertTrue(review.sharedPasswordWith(c.getInternalId()).isEmpty());
    }

    @Test
    @DisplayName("Isolated records pass through and are audited as risky merges avoided")
    void isolatedRecordsPassThrough() {
        VaultItem bare = VaultItem.builder().password("x").build();
        VaultItem single = login().build();

        ResolutionResult result = resolve(List.of(bare, single), GroupingOptions.defaults());

        assertEquals(List.of(bare, single), result.autoResolvedRecords());
        assertEquals(List.of(bare), result.riskyMergesAvoided());
        assertEquals(List.of("cluster-1", "cluster-2"), result.clusterOrder());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.RISKY_MERGE_AVOIDED).size());
    }
}
