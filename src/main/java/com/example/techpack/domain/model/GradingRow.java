package com.example.techpack.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the grading table: one parameter with a value per size column.
 * Columns without a value are empty strings.
 */
@JsonPropertyOrder({"parameter", "XS", "S", "M", "L", "XL", "2XL", "3XL"})
public record GradingRow(
        @JsonProperty("parameter") String parameter,
        @JsonProperty("XS") String xs,
        @JsonProperty("S") String s,
        @JsonProperty("M") String m,
        @JsonProperty("L") String l,
        @JsonProperty("XL") String xl,
        @JsonProperty("2XL") String xxl,
        @JsonProperty("3XL") String xxxl
) {

    /**
     * Looks up a column by its size label.
     *
     * @param size size column
     * @return cell value, possibly empty
     */
    public String valueFor(SizeLabel size) {
        return switch (size) {
            case XS -> xs;
            case S -> s;
            case M -> m;
            case L -> l;
            case XL -> xl;
            case XXL -> xxl;
            case XXXL -> xxxl;
        };
    }
}
