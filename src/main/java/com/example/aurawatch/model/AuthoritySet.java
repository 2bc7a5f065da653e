package com.example.aurawatch.model;

import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Ordered authority list. The order defines the round-robin slot assignment.
 */
@EqualsAndHashCode
public final class AuthoritySet {

    private final List<AuthorityKey> members;

    public AuthoritySet(List<AuthorityKey> members) {
        this.members = List.copyOf(members);
    }

    public static AuthoritySet empty() {
        return new AuthoritySet(List.of());
    }

    public List<AuthorityKey> getMembers() {
        return members;
    }

    public AuthorityKey get(int index) {
        return members.get(index);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public String toString() {
        return "AuthoritySet(size=" + members.size() + ")";
    }
}
