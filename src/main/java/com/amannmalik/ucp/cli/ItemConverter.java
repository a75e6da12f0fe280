package com.amannmalik.ucp.cli;

import com.amannmalik.ucp.api.checkout.model.Item;
import picocli.CommandLine;

/// Parses {@code id}, {@code id:quantity} or {@code id:quantity:title}.
public final class ItemConverter implements CommandLine.ITypeConverter<Item> {
    public ItemConverter() {
    }

    @Override
    public Item convert(String value) {
        var parts = value.split(":", 3);
        try {
            var quantity = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 1;
            var title = parts.length > 2 ? parts[2] : "";
            return new Item(parts[0].trim(), title, quantity);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException("Invalid item '" + value + "': " + e.getMessage());
        }
    }
}
