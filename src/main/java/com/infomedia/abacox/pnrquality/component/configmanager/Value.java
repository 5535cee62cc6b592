package com.infomedia.abacox.pnrquality.component.configmanager;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DateTimeException;
import java.time.ZoneId;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class Value {

    private String key;

    private String value;

    private String getErrorMessage(String targetType) {
        return String.format("Configuration value '%s' for key '%s' cannot be converted to %s.", value, key, targetType);
    }

    public String asString() {
        return value;
    }

    public Integer asInteger() {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("Integer"), e);
        }
    }

    public ZoneId asZoneId() {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("ZoneId"), e);
        }
    }
}
