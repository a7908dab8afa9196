package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bitwarden individual vault CSV export.
 * {@code login_uri} may hold several comma-separated URIs; the first becomes the
 * primary URL and the rest secondary URLs.
 */
public class BitwardenPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "bitwarden";

    private static final List<String> EXPORT_COLUMNS = List.of(
            "folder", "favorite", "type", "name", "notes", "fields", "reprompt",
            "login_uri", "login_username", "login_password", "login_totp");

    public BitwardenPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("type", "name"),
                        List.of("folder", "favorite", "notes", "fields", "reprompt",
                                "login_uri", "login_username", "login_password", "login_totp")),
                EXPORT_COLUMNS,
                List.of("fields", "reprompt"));
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(ItemType.fromLabel(row.get("type")))
                .title(row.get("name"))
                .notes(row.get("notes"))
                .folder(emptyToNull(row.get("folder")))
                .favorite(isTruthy(row.get("favorite")))
                .username(row.get("login_username"))
                .password(row.get("login_password"));
        assignTotp(builder, row.get("login_totp"));

        List<String> uris = splitUris(row.get("login_uri"));
        if (!uris.isEmpty()) {
            builder.primaryUrl(uris.get(0));
            builder.secondaryUrls(uris.subList(1, uris.size()));
        }
        preserveRaw(builder, row, "type");
        preserveRaw(builder, row, "favorite");
        preserveRaw(builder, row, "login_uri");
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("folder", nullToEmpty(item.getFolder()));
        values.put("favorite", rawOr(item, "favorite", item.isFavorite() ? "1" : ""));
        values.put("type", rawOr(item, "type", item.getItemType().getLabel()));
        values.put("name", item.getTitle());
        values.put("notes", item.getNotes());
        values.put("login_uri", rawOr(item, "login_uri", joinUris(item)));
        values.put("login_username", item.getUsername());
        values.put("login_password", item.getPassword());
        values.put("login_totp", item.getTotpValue());
    }

    private static List<String> splitUris(String raw) {
        List<String> uris = new ArrayList<>();
        for (String part : raw.split(",")) {
            String uri = part.trim();
            if (!uri.isEmpty()) {
                uris.add(uri);
            }
        }
        return uris;
    }

    private static String joinUris(VaultItem item) {
        List<String> uris = new ArrayList<>();
        if (item.getPrimaryUrl() != null) {
            uris.add(item.getPrimaryUrl());
        }
        uris.addAll(item.getSecondaryUrls());
        return String.join(",", uris);
    }
}
