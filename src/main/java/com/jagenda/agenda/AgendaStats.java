package com.jagenda.agenda;

/**
 * Point-in-time figures about an agenda's index.
 */
public final class AgendaStats {
    private final int contacts;
    private final int height;
    private final long rotations;

    AgendaStats(int contacts, int height, long rotations) {
        this.contacts = contacts;
        this.height = height;
        this.rotations = rotations;
    }

    public int getContacts() {
        return contacts;
    }

    public int getHeight() {
        return height;
    }

    public long getRotations() {
        return rotations;
    }

    @Override
    public String toString() {
        return "contacts=" + contacts + ", height=" + height + ", rotations=" + rotations;
    }
}
