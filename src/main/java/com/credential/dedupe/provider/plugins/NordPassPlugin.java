package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * NordPass CSV export. One file mixes logins, cards and identities; the item type is
 * inferred from which card or identity columns are filled.
 */
public class NordPassPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "nordpass";

    private static final List<String> CORE_COLUMNS = List.of("name", "url", "username", "password");

    private static final List<String> CARD_COLUMNS = List.of(
            "cardholdername", "cardnumber", "cvc", "expirydate", "zipcode");

    private static final List<String> IDENTITY_COLUMNS = List.of(
            "full_name", "phone_number", "email", "address1", "address2", "city", "country", "state");

    public NordPassPlugin() {
        super(PROVIDER_ID,
                HeaderSpec.of(CORE_COLUMNS, optionalColumns()),
                exportColumns(),
                extraColumns());
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(inferType(row))
                .title(row.get("name"))
                .primaryUrl(emptyToNull(row.get("url")))
                .username(row.get("username"))
                .password(row.get("password"))
                .notes(row.get("note"))
                .folder(emptyToNull(row.get("folder")));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("name", item.getTitle());
        values.put("url", nullToEmpty(item.getPrimaryUrl()));
        values.put("username", item.getUsername());
        values.put("password", item.getPassword());
        values.put("note", item.getNotes());
        values.put("folder", nullToEmpty(item.getFolder()));
        values.put("email", item.getEmail());
    }

    private static ItemType inferType(RowView row) {
        if (!row.get("cardnumber").isBlank() || !row.get("cardholdername").isBlank()) {
            return ItemType.CARD;
        }
        if (!row.get("full_name").isBlank() || !row.get("address1").isBlank() || !row.get("city").isBlank()) {
            return ItemType.IDENTITY;
        }
        return ItemType.LOGIN;
    }

    private static List<String> optionalColumns() {
        List<String> columns = new ArrayList<>();
        columns.add("note");
        columns.addAll(CARD_COLUMNS);
        columns.add("folder");
        columns.addAll(IDENTITY_COLUMNS);
        return columns;
    }

    private static List<String> exportColumns() {
        List<String> columns = new ArrayList<>(CORE_COLUMNS);
        columns.addAll(optionalColumns());
        return columns;
    }

    private static List<String> extraColumns() {
        List<String> columns = new ArrayList<>(CARD_COLUMNS);
        columns.addAll(IDENTITY_COLUMNS);
        return columns;
    }
}
