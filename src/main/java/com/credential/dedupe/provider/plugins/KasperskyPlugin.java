package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Map;

/**
 * Kaspersky Password Manager CSV import format.
 */
public class KasperskyPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "kaspersky";

    public KasperskyPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("Account", "Login", "Password", "Url"), List.of()),
                List.of("Account", "Login", "Password", "Url"),
                List.of());
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(ItemType.LOGIN)
                .title(row.get("Account"))
                .username(row.get("Login"))
                .password(row.get("Password"))
                .primaryUrl(emptyToNull(row.get("Url")));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("Account", item.getTitle());
        values.put("Login", item.getUsername());
        values.put("Password", item.getPassword());
        values.put("Url", nullToEmpty(item.getPrimaryUrl()));
    }
}
