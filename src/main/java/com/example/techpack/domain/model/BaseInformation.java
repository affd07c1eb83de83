package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Header facts of a tech pack (buyer, order number, style...). Missing fields are empty strings.
 */
@JsonPropertyOrder({"buyer", "orderNo", "styleRef", "fit", "season", "modified"})
public record BaseInformation(
        String buyer,
        String orderNo,
        String styleRef,
        String fit,
        String season,
        String modified
) {

    public static BaseInformation empty() {
        return new BaseInformation("", "", "", "", "", "");
    }
}
