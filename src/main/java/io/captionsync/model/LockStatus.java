package io.captionsync.model;

/**
 * Lock state as seen by this client. {@code canEdit} holds only while the lock is granted to this client.
 */
public record LockStatus(LockState state, String holder, boolean canEdit) {

    public LockStatus {
        if (state == null) {
            state = LockState.RELEASED;
        }
        holder = holder == null || holder.isBlank() ? null : holder;
    }

    public static LockStatus released() {
        return new LockStatus(LockState.RELEASED, null, false);
    }

    public static LockStatus pending(String self) {
        return new LockStatus(LockState.PENDING, self, false);
    }

    public static LockStatus derive(LockState state, String holder, String self) {
        boolean editable = state == LockState.GRANTED && holder != null && holder.equals(self);
        return new LockStatus(state, holder, editable);
    }

    public boolean heldBy(String clientId) {
        return holder != null && holder.equals(clientId);
    }
}
