package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dashlane CSV import template. {@code Email} stays in {@code extra} and takes part
 * in email/username equivalence.
 */
public class DashlanePlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "dashlane";

    private static final List<String> EXPORT_COLUMNS = List.of(
            "Type", "Name", "Website URL", "Username", "Email",
            "Secondary Login", "Password", "Comment", "collections");

    public DashlanePlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("Type", "Name", "Website URL", "Password"),
                        List.of("Username", "Email", "Secondary Login", "Comment", "collections")),
                EXPORT_COLUMNS,
                List.of("Email", "Secondary Login", "collections"));
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        String type = row.get("Type").trim().toLowerCase(Locale.ROOT);
        builder.itemType(type.isEmpty() || type.startsWith("login") ? ItemType.LOGIN : ItemType.OTHER)
                .title(row.get("Name"))
                .primaryUrl(emptyToNull(row.get("Website URL")))
                .username(row.get("Username"))
                .password(row.get("Password"))
                .notes(row.get("Comment"));
        preserveRaw(builder, row, "Type");
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("Type", rawOr(item, "Type", "Login"));
        values.put("Name", item.getTitle());
        values.put("Website URL", nullToEmpty(item.getPrimaryUrl()));
        values.put("Username", item.getUsername());
        values.put("Email", item.getEmail());
        values.put("Password", item.getPassword());
        values.put("Comment", item.getNotes());
    }
}
