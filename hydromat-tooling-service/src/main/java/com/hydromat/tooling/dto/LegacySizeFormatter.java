package com.hydromat.tooling.dto;

import com.hydromat.tooling.model.MaterialSize;
import com.hydromat.tooling.model.ProductSizeVariant;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Display strings that older screens expect in place of the normalized size records.
 */
public final class LegacySizeFormatter {

    private LegacySizeFormatter() {
    }

    /**
     * "18 x 40" style blank size.
     */
    public static String materialSize(MaterialSize size) {
        if (size == null) {
            return "";
        }
        return number(size.getWidth()) + " x " + number(size.getThickness());
    }

    /**
     * "90 × 18 mm (±0.5)", or "90 mm (±0.5)" without a thickness.
     */
    public static String productVariant(ProductSizeVariant variant) {
        if (variant == null) {
            return "";
        }
        String tolerance = number(variant.getTolerance() != null ? variant.getTolerance() : 0.5);
        if (variant.getThickness() != null) {
            return number(variant.getWidth()) + " × " + number(variant.getThickness())
                    + " mm (±" + tolerance + ")";
        }
        return number(variant.getWidth()) + " mm (±" + tolerance + ")";
    }

    public static String productVariants(List<ProductSizeVariant> variants) {
        if (variants == null || variants.isEmpty()) {
            return "";
        }
        return variants.stream()
                .map(LegacySizeFormatter::productVariant)
                .collect(Collectors.joining("; "));
    }

    /**
     * Plain decimal without trailing zeros (40.0 -> "40", 0.50 -> "0.5").
     */
    public static String number(Double value) {
        if (value == null) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
