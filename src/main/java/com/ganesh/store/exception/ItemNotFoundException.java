package com.ganesh.store.exception;

/**
 * Thrown when there is no live Item for an ID, either because it never existed, was deleted, or
 * expired and was removed during the lookup.
 */
public class ItemNotFoundException extends StoreException {

    private final String itemId;

    public ItemNotFoundException(String itemId) {
        super("No Item found for ID " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
