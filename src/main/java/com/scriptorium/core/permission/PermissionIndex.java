package com.scriptorium.core.permission;

import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.PermissionDeniedException;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.persistence.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-branch, per-user access flags. The absence of a row means no access.
 */
@Service
public class PermissionIndex {

    private static final Logger log = LoggerFactory.getLogger(PermissionIndex.class);

    private final IndexStore store;

    public PermissionIndex(IndexStore store) {
        this.store = store;
    }

    /**
     * Raw flags stored for a user on a branch, {@link PermissionFlags#NONE} when absent.
     */
    public PermissionFlags get(UUID branchId, UUID userId) {
        return store.findPermission(branchId, userId)
                .map(BranchPermission::flags)
                .orElse(PermissionFlags.NONE);
    }

    /**
     * Idempotent upsert; the last writer wins.
     */
    public void grant(UUID branchId, UUID userId, PermissionFlags flags, UUID grantedBy) {
        Objects.requireNonNull(flags, "flags must not be null");
        store.upsertPermission(new BranchPermission(branchId, userId, flags, grantedBy, Instant.now()));
        log.info("Granted {} on branch {} to user {} (by {})", describe(flags), branchId, userId, grantedBy);
    }

    public void requireRead(Branch branch, Actor actor) {
        if (!get(branch.id(), actor.id()).allowsRead()) {
            throw denied(branch, actor, "read");
        }
    }

    /**
     * Write access; protected branches additionally require admin.
     */
    public void requireWrite(Branch branch, Actor actor) {
        PermissionFlags flags = get(branch.id(), actor.id());
        if (!flags.allowsWrite()) {
            throw denied(branch, actor, "write");
        }
        if (branch.isProtected() && !flags.allowsAdmin()) {
            throw new PermissionDeniedException(
                    "Branch '" + branch.name() + "' is protected; admin permission required to write");
        }
    }

    public void requireAdmin(Branch branch, Actor actor) {
        if (!get(branch.id(), actor.id()).allowsAdmin()) {
            throw denied(branch, actor, "admin");
        }
    }

    /**
     * Effective flags of {@code userId} on a branch. Callers may always query
     * themselves; querying someone else requires admin.
     */
    public PermissionFlags getBranchPermission(UUID branchId, UUID userId, Actor actor) {
        Branch branch = requireBranch(branchId);
        if (!userId.equals(actor.id())) {
            requireAdmin(branch, actor);
        }
        return get(branchId, userId).effective();
    }

    /**
     * Replaces the flags of {@code userId} on a branch. Requires admin.
     */
    public PermissionFlags updateBranchPermission(UUID branchId, UUID userId, PermissionFlags flags, Actor actor) {
        Branch branch = requireBranch(branchId);
        requireAdmin(branch, actor);
        grant(branchId, userId, flags, actor.id());
        return flags.effective();
    }

    private Branch requireBranch(UUID branchId) {
        return store.findBranch(branchId)
                .orElseThrow(() -> new NotFoundException("Branch not found: " + branchId));
    }

    private static PermissionDeniedException denied(Branch branch, Actor actor, String level) {
        log.debug("User {} lacks {} permission on branch {}", actor.id(), level, branch.id());
        return new PermissionDeniedException(
                "No " + level + " permission on branch '" + branch.name() + "'");
    }

    private static String describe(PermissionFlags flags) {
        return "read=" + flags.canRead() + " write=" + flags.canWrite() + " admin=" + flags.canAdmin();
    }
}
