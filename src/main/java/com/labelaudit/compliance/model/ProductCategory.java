package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Coarse product category guessed from the listing title, used to slice
 * manufacturer analytics. Checked in declaration order; first match wins.
 */
public enum ProductCategory {
    FOOD_AND_BEVERAGES("Food & Beverages", List.of(
            "food", "snack", "biscuit", "chocolate", "drink", "beverage", "juice", "milk", "yogurt", "cheese",
            "bread", "cereal", "spice", "oil", "sauce", "pickle", "jam", "honey", "tea", "coffee")),
    PHARMACEUTICALS("Pharmaceuticals", List.of(
            "medicine", "tablet", "capsule", "syrup", "ointment", "injection", "drops", "supplement",
            "vitamin", "calcium", "protein", "multivitamin")),
    COSMETICS("Cosmetics & Personal Care", List.of(
            "cosmetic", "cream", "lotion", "shampoo", "soap", "beauty", "makeup", "lipstick", "perfume",
            "deodorant", "toothpaste", "skincare")),
    ELECTRONICS("Electronics", List.of(
            "electronic", "phone", "charger", "cable", "device", "battery", "headphone", "speaker", "camera",
            "laptop", "usb", "bluetooth")),
    TEXTILES("Textiles & Clothing", List.of(
            "clothing", "shirt", "dress", "fabric", "textile", "saree", "kurta", "jeans", "trouser", "jacket",
            "towel", "bedding")),
    HOME_AND_KITCHEN("Home & Kitchen", List.of(
            "kitchen", "cookware", "utensil", "plate", "bowl", "container", "cleaning", "detergent", "mop")),
    GENERAL("General Products", List.of());

    private final String label;
    private final List<String> keywords;

    ProductCategory(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    @JsonValue
    public String getLabel() { return label; }

    public static ProductCategory classify(String title) {
        if (title == null || title.isBlank()) return GENERAL;
        String t = title.toLowerCase(Locale.ROOT);
        for (ProductCategory c : values()) {
            for (String k : c.keywords) {
                if (t.contains(k)) return c;
            }
        }
        return GENERAL;
    }

    public static ProductCategory fromLabel(String label) {
        for (ProductCategory c : values()) {
            if (c.label.equalsIgnoreCase(label) || c.name().equalsIgnoreCase(label)) return c;
        }
        return GENERAL;
    }
}
