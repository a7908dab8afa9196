package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.List;
import java.util.Map;

/**
 * Apple Passwords / Safari CSV export.
 */
public class ApplePasswordsPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "apple_passwords";

    public ApplePasswordsPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("Title", "URL", "Username", "Password"), List.of("Notes", "OTPAuth")),
                List.of("Title", "URL", "Username", "Password", "Notes", "OTPAuth"),
                List.of());
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(ItemType.LOGIN)
                .title(row.get("Title"))
                .primaryUrl(emptyToNull(row.get("URL")))
                .username(row.get("Username"))
                .password(row.get("Password"))
                .notes(row.get("Notes"));
        assignTotp(builder, row.get("OTPAuth"));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("Title", item.getTitle());
        values.put("URL", nullToEmpty(item.getPrimaryUrl()));
        values.put("Username", item.getUsername());
        values.put("Password", item.getPassword());
        values.put("Notes", item.getNotes());
        values.put("OTPAuth", item.getTotpValue());
    }
}
