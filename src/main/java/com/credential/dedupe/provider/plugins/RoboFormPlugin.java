package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Map;

/**
 * RoboForm CSV export.
 */
public class RoboFormPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "roboform";

    private static final List<String> EXPORT_COLUMNS = List.of(
            "Name", "URL", "MatchUrl", "Login", "Password", "Note", "Folder", "RfFieldsV2");

    public RoboFormPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("Name", "URL", "Login", "Password"),
                        List.of("MatchUrl", "Note", "Folder", "RfFieldsV2")),
                EXPORT_COLUMNS,
                List.of("MatchUrl", "RfFieldsV2"));
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(ItemType.LOGIN)
                .title(row.get("Name"))
                .primaryUrl(emptyToNull(row.get("URL")))
                .username(row.get("Login"))
                .password(row.get("Password"))
                .notes(row.get("Note"))
                .folder(emptyToNull(row.get("Folder")));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("Name", item.getTitle());
        values.put("URL", nullToEmpty(item.getPrimaryUrl()));
        values.put("Login", item.getUsername());
        values.put("Password", item.getPassword());
        values.put("Note", item.getNotes());
        values.put("Folder", nullToEmpty(item.getFolder()));
    }
}
