package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;
import com.credential.dedupe.rules.DefaultTimestampParsers;
import com.credential.dedupe.rules.TimestampParserChain;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Proton Pass CSV export.
 *
 * <p>Import columns: {@code type,name,url,email,username,password,note,totp,createTime,modifyTime,vault}.
 * Export drops {@code type}, {@code createTime} and {@code modifyTime}; they still shape
 * grouping (item type) and preferred-record selection (timestamps) before export.</p>
 */
public class ProtonPassPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "protonpass";

    static final List<String> IMPORT_COLUMNS = List.of(
            "type", "name", "url", "email", "username", "password",
            "note", "totp", "createTime", "modifyTime", "vault");

    static final List<String> EXPORT_COLUMNS = List.of(
            "name", "url", "email", "username", "password", "note", "totp", "vault");

    private final TimestampParserChain timestampParser;

    public ProtonPassPlugin() {
        this(DefaultTimestampParsers.defaultChain());
    }

    public ProtonPassPlugin(TimestampParserChain timestampParser) {
        super(PROVIDER_ID, HeaderSpec.of(IMPORT_COLUMNS, List.of()), EXPORT_COLUMNS, List.of("email"));
        this.timestampParser = timestampParser;
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        builder.itemType(mapType(row.get("type")))
                .title(row.get("name"))
                .primaryUrl(emptyToNull(row.get("url")))
                .username(row.get("username"))
                .password(row.get("password"))
                .notes(row.get("note"))
                .folder(emptyToNull(row.get("vault")))
                .createdAt(timestampParser.parse(row.get("createTime")).orElse(null))
                .updatedAt(timestampParser.parse(row.get("modifyTime")).orElse(null));
        assignTotp(builder, row.get("totp"));
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("name", item.getTitle());
        values.put("url", nullToEmpty(item.getPrimaryUrl()));
        values.put("email", item.getEmail());
        values.put("username", item.getUsername());
        values.put("password", item.getPassword());
        values.put("note", item.getNotes());
        values.put("totp", item.getTotpValue());
        values.put("vault", nullToEmpty(item.getFolder()));
    }

    private static ItemType mapType(String raw) {
        String key = raw.trim().toLowerCase(Locale.ROOT);
        if (key.equals("creditcard")) {
            return ItemType.CARD;
        }
        return ItemType.fromLabel(key);
    }
}
