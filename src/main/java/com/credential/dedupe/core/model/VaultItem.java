package com.credential.dedupe.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Canonical, provider-agnostic representation of one credential entry.
 *
 * <p>Provider plugins create items on import and consume them on export. Text fields
 * ({@code title}, {@code username}, {@code password}, {@code notes}) are never null;
 * absent values are empty strings. Timestamps are epoch milliseconds.</p>
 *
 * <p>Items are immutable. The merge step produces a copy through {@link #withNotes(String)},
 * which keeps the identity fields ({@code source}, {@code sourceId}, {@code internalId})
 * of the original.</p>
 */
public class VaultItem {
    private final ItemType itemType;
    private final String source;
    private final String sourceId;
    private final String internalId;
    private final String title;
    private final String username;
    private final String password;
    private final String primaryUrl;
    private final List<String> secondaryUrls;
    private final String notes;
    private final String folder;
    private final Set<String> tags;
    private final boolean favorite;
    private final String totpUri;
    private final String totpSecret;
    private final Long createdAt;
    private final Long updatedAt;
    private final Map<String, String> extra;

    private VaultItem(Builder builder) {
        this.itemType = builder.itemType != null ? builder.itemType : ItemType.LOGIN;
        this.source = builder.source;
        this.sourceId = builder.sourceId;
        this.internalId = builder.internalId != null ? builder.internalId : UUID.randomUUID().toString();
        this.title = nullToEmpty(builder.title);
        this.username = nullToEmpty(builder.username);
        this.password = nullToEmpty(builder.password);
        this.primaryUrl = builder.primaryUrl;
        this.secondaryUrls = List.copyOf(new LinkedHashSet<>(builder.secondaryUrls));
        this.notes = nullToEmpty(builder.notes);
        this.folder = builder.folder;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.favorite = builder.favorite;
        this.totpUri = builder.totpUri;
        this.totpSecret = builder.totpSecret;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    }

    public ItemType getItemType() {
        return itemType;
    }

    public String getSource() {
        return source;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getInternalId() {
        return internalId;
    }

    public String getTitle() {
        return title;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getPrimaryUrl() {
        return primaryUrl;
    }

    public List<String> getSecondaryUrls() {
        return secondaryUrls;
    }

    public String getNotes() {
        return notes;
    }

    public String getFolder() {
        return folder;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean isFavorite() {
        return favorite;
    }

    public String getTotpUri() {
        return totpUri;
    }

    public String getTotpSecret() {
        return totpSecret;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public Map<String, String> getExtra() {
        return extra;
    }

    /**
     * Returns the email-bearing field of this item, or an empty string.
     * Providers keep email columns in {@code extra} under their own column name
     * ({@code email}, {@code Email}); the first non-empty one in key order wins.
     */
    public String getEmail() {
        Map<String, String> sorted = new TreeMap<>(extra);
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey().equalsIgnoreCase("email") && e.getValue() != null && !e.getValue().isEmpty()) {
                return e.getValue();
            }
        }
        return "";
    }

    /**
     * Returns the TOTP value as a provider would store it in a single column:
     * the otpauth URI when present, otherwise the raw secret.
     */
    public String getTotpValue() {
        if (totpUri != null && !totpUri.isEmpty()) {
            return totpUri;
        }
        return totpSecret != null ? totpSecret : "";
    }

    /**
     * Returns a copy of this item with different notes. Identity fields are kept.
     */
    public VaultItem withNotes(String newNotes) {
        return builder(this).notes(newNotes).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VaultItem item = (VaultItem) o;
        return Objects.equals(internalId, item.internalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(internalId);
    }

    @Override
    public String toString() {
        // secrets and notes intentionally left out
        return "VaultItem{" +
                "internalId='" + internalId + '\'' +
                ", source='" + source + '\'' +
                ", itemType=" + itemType +
                ", title='" + title + '\'' +
                ", primaryUrl='" + primaryUrl + '\'' +
                ", updatedAt=" + updatedAt +
                '}';
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(VaultItem item) {
        return new Builder()
                .itemType(item.itemType)
                .source(item.source)
                .sourceId(item.sourceId)
                .internalId(item.internalId)
                .title(item.title)
                .username(item.username)
                .password(item.password)
                .primaryUrl(item.primaryUrl)
                .secondaryUrls(item.secondaryUrls)
                .notes(item.notes)
                .folder(item.folder)
                .tags(item.tags)
                .favorite(item.favorite)
                .totpUri(item.totpUri)
                .totpSecret(item.totpSecret)
                .createdAt(item.createdAt)
                .updatedAt(item.updatedAt)
                .extra(item.extra);
    }

    public static class Builder {
        private ItemType itemType;
        private String source;
        private String sourceId;
        private String internalId;
        private String title;
        private String username;
        private String password;
        private String primaryUrl;
        private final List<String> secondaryUrls = new ArrayList<>();
        private String notes;
        private String folder;
        private final Set<String> tags = new LinkedHashSet<>();
        private boolean favorite;
        private String totpUri;
        private String totpSecret;
        private Long createdAt;
        private Long updatedAt;
        private final Map<String, String> extra = new LinkedHashMap<>();

        public Builder itemType(ItemType itemType) {
            this.itemType = itemType;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder internalId(String internalId) {
            this.internalId = internalId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder primaryUrl(String primaryUrl) {
            this.primaryUrl = primaryUrl;
            return this;
        }

        public Builder secondaryUrls(List<String> urls) {
            this.secondaryUrls.clear();
            if (urls != null) {
                urls.forEach(this::addSecondaryUrl);
            }
            return this;
        }

        public Builder addSecondaryUrl(String url) {
            if (url != null && !url.isEmpty()) {
                this.secondaryUrls.add(url);
            }
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder folder(String folder) {
            this.folder = folder;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder favorite(boolean favorite) {
            this.favorite = favorite;
            return this;
        }

        public Builder totpUri(String totpUri) {
            this.totpUri = totpUri;
            return this;
        }

        public Builder totpSecret(String totpSecret) {
            this.totpSecret = totpSecret;
            return this;
        }

        public Builder createdAt(Long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Long updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder extra(Map<String, String> extra) {
            this.extra.clear();
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        public Builder putExtra(String key, String value) {
            this.extra.put(Objects.requireNonNull(key, "extra key is required"),
                    value != null ? value : "");
            return this;
        }

        public VaultItem build() {
            return new VaultItem(this);
        }
    }
}
