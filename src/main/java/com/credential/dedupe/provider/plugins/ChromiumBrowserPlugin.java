package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Map;

/**
 * Chromium-family browsers (Chrome, Edge, Brave, Opera) password export.
 */
public class ChromiumBrowserPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "chromium_browser";

    public ChromiumBrowserPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("name", "url", "username", "password"), List.of("note")),
                List.of("name", "url", "username", "password", "note"),
                List.of());
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(ItemType.LOGIN)
                .title(row.get("name"))
                .primaryUrl(emptyToNull(row.get("url")))
                .username(row.get("username"))
                .password(row.get("password"))
                .notes(row.get("note"));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("name", item.getTitle());
        values.put("url", nullToEmpty(item.getPrimaryUrl()));
        values.put("username", item.getUsername());
        values.put("password", item.getPassword());
        values.put("note", item.getNotes());
    }
}
