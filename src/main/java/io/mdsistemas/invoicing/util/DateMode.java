package io.mdsistemas.invoicing.util;

import java.util.Locale;

public enum DateMode {
    CURRENT, SALE_DATE, CUSTOM;

    /**
     * Maps the {@code modoData} request value; unknown or missing values fall back to {@link #CURRENT}.
     */
    public static DateMode fromRequest(String modeName) {
        if (modeName == null) return CURRENT;
        return switch (modeName.trim().toLowerCase(Locale.ROOT)) {
            case "venda", "sale", "sale_date" -> SALE_DATE;
            case "escolher", "choose", "custom" -> CUSTOM;
            default -> CURRENT;
        };
    }
}
