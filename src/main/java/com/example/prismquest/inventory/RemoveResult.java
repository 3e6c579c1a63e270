package com.example.prismquest.inventory;

import com.example.prismquest.model.InventoryStack;

import java.util.List;

/**
 * Inventory after a removal attempt. When {@code removed} is false the list is the
 * unchanged input.
 */
public record RemoveResult(List<InventoryStack> inventory, boolean removed) {

    public RemoveResult {
        inventory = List.copyOf(inventory);
    }
}
