package com.scriptorium.core.persistence;

import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.PermissionFlags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIndexStoreTest extends IndexStoreContract {

    @Override
    protected IndexStore createStore() {
        return new InMemoryIndexStore();
    }

    @Test
    @DisplayName("in-memory store is not durable")
    void notDurable() {
        assertFalse(store.isDurable());
    }

    @Test
    @DisplayName("inserting the same branch id twice fails")
    void duplicateBranchId() {
        assertThrows(IllegalStateException.class, () -> store.insertBranch(main,
                new BranchPermission(main.id(), owner, PermissionFlags.FULL, owner, now)));
    }
}
