package net.belfry.proto;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named group of connections exchanging messages.
 * Not thread-safe by itself; guarded by the owning ChannelRegistry.
 */
public class Channel {

    private final String id;
    private final Set<Connection> members;

    public Channel(String id) {
        this.id = id;
        this.members = new LinkedHashSet<Connection>();
    }

    public String getId() {
        return id;
    }

    /**
     * A stable copy of the current member set.
     * Safe to iterate while members are added or removed.
     */
    public List<Connection> getMembers() {
        return new ArrayList<Connection>(members);
    }

    public int size() {
        return members.size();
    }

    public boolean contains(Connection conn) {
        return members.contains(conn);
    }

    /**
     * Whether an open host other than exclude is among the members.
     */
    public boolean hasOpenHost(Connection exclude) {
        for (Connection c : members) {
            if (c != exclude && c.isHost() && c.isOpen()) return true;
        }
        return false;
    }

    /**
     * The number of members that are open or still connecting.
     */
    public int countActive() {
        int ret = 0;
        for (Connection c : members) {
            if (c.getState().isActive()) ret++;
        }
        return ret;
    }

    public boolean isActive() {
        return countActive() != 0;
    }

    void add(Connection conn) {
        members.add(conn);
    }

    boolean remove(Connection conn) {
        return members.remove(conn);
    }

    public String toString() {
        return "Channel[" + id + "]";
    }

}
