package com.credential.dedupe.provider.plugins;

import com.credential.dedupe.core.model.ItemType;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.provider.AbstractProviderPlugin;
import com.credential.dedupe.provider.HeaderSpec;
import com.credential.dedupe.rules.DefaultTimestampParsers;
import com.credential.dedupe.rules.TimestampParserChain;

import java.util.List;
import java.util.Map;

/**
 * Firefox {@code about:logins} CSV export. Timestamps are epoch milliseconds;
 * {@code guid} becomes the source id.
 */
public class FirefoxPlugin extends AbstractProviderPlugin {

    public static final String PROVIDER_ID = "firefox";

    private static final List<String> OPTIONAL_COLUMNS = List.of(
            "httpRealm", "formActionOrigin", "guid", "timeCreated", "timeLastUsed", "timePasswordChanged");

    private final TimestampParserChain timestampParser;

    public FirefoxPlugin() {
        this(DefaultTimestampParsers.defaultChain());
    }

    public FirefoxPlugin(TimestampParserChain timestampParser) {
        super(PROVIDER_ID,
                HeaderSpec.of(List.of("url", "username", "password"), OPTIONAL_COLUMNS),
                List.of("url", "username", "password", "httpRealm", "formActionOrigin", "guid",
                        "timeCreated", "timeLastUsed", "timePasswordChanged"),
                List.of("httpRealm", "formActionOrigin", "timeLastUsed"));
        this.timestampParser = timestampParser;
    }

    @Override
    protected void mapRow(RowView row, VaultItem.Builder builder) {
        Long changed = timestampParser.parse(row.get("timePasswordChanged"))
                .or(() -> timestampParser.parse(row.get("timeLastUsed")))
                .orElse(null);
        builder.itemType(ItemType.LOGIN)
                .primaryUrl(emptyToNull(row.get("url")))
                .username(row.get("username"))
                .password(row.get("password"))
                .sourceId(emptyToNull(row.get("guid")))
                .createdAt(timestampParser.parse(row.get("timeCreated")).orElse(null))
                .updatedAt(changed);
        preserveRaw(builder, row, "timeCreated");
        preserveRaw(builder, row, "timePasswordChanged");
    }

    @Override
    protected void mapItem(VaultItem item, Map<String, String> values) {
        values.put("url", nullToEmpty(item.getPrimaryUrl()));
        values.put("username", item.getUsername());
        values.put("password", item.getPassword());
        values.put("guid", PROVIDER_ID.equals(item.getSource()) ? nullToEmpty(item.getSourceId()) : "");
        values.put("timeCreated", rawOr(item, "timeCreated", epochOrEmpty(item.getCreatedAt())));
        values.put("timePasswordChanged", rawOr(item, "timePasswordChanged", epochOrEmpty(item.getUpdatedAt())));
    }

    private static String epochOrEmpty(Long epochMillis) {
        return epochMillis != null ? String.valueOf(epochMillis) : "";
    }
}
