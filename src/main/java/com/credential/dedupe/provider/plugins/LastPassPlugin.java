package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Map;

/**
 * LastPass CSV export. Secure notes carry the pseudo URL {@code http://sn}.
 */
public class LastPassPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "lastpass";

    static final String SECURE_NOTE_URL = "http://sn";

    private static final List<String> EXPORT_COLUMNS = List.of(
            "url", "username", "password", "totp", "extra", "name", "grouping", "fav");

    public LastPassPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("url", "username", "password"),
                        List.of("totp", "extra", "name", "grouping", "fav")),
                EXPORT_COLUMNS,
                List.of());
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        String url = row.get("url");
        if (SECURE_NOTE_URL.equalsIgnoreCase(url.trim())) {
            builder.itemType(ItemType.NOTE);
            preserveRaw(builder, row, "url");
        } else {
            builder.itemType(ItemType.LOGIN).primaryUrl(emptyToNull(url));
        }
        builder.username(row.get("username"))
                .password(row.get("password"))
                .notes(row.get("extra"))
                .title(row.get("name"))
                .folder(emptyToNull(row.get("grouping")))
                .favorite(isTruthy(row.get("fav")));
        assignTotp(builder, row.get("totp"));
        preserveRaw(builder, row, "fav");
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        String url = item.getPrimaryUrl() == null && item.getItemType() == ItemType.NOTE
                ? SECURE_NOTE_URL : nullToEmpty(item.getPrimaryUrl());
        values.put("url", rawOr(item, "url", url));
        values.put("username", item.getUsername());
        values.put("password", item.getPassword());
        values.put("totp", item.getTotpValue());
        values.put("extra", item.getNotes());
        values.put("name", item.getTitle());
        values.put("grouping", nullToEmpty(item.getFolder()));
        values.put("fav", rawOr(item, "fav", item.isFavorite() ? "1" : "0"));
    }
}
