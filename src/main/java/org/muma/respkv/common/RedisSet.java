package org.muma.respkv.common;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class RedisSet implements RedisValue {

    private final Set<Bytes> members;

    public RedisSet() {
        this.members = new HashSet<>();
    }

    private RedisSet(Set<Bytes> members) {
        this.members = members;
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.SET;
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public RedisValue copy() {
        return new RedisSet(new HashSet<>(members));
    }

    public int add(Bytes member) {
        return members.add(member) ? 1 : 0;
    }

    public int remove(Bytes member) {
        return members.remove(member) ? 1 : 0;
    }

    public boolean contains(Bytes member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    public List<Bytes> getAll() {
        return new ArrayList<>(members);
    }
}
