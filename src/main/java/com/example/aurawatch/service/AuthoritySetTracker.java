package com.example.aurawatch.service;

import com.example.aurawatch.model.AuthorityKey;
import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.Fingerprint;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.rpc.ChainRpc;
import com.example.aurawatch.util.Sha;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Reads the current authority set and tells whether it changed.
 */
@Service
@RequiredArgsConstructor
public class AuthoritySetTracker {

    private final ChainRpc chainRpc;

    public AuthoritySet fetch() {
        return chainRpc.getAuthorities();
    }

    /**
     * SHA-256 over the raw keys in set order; reordering changes it.
     */
    public Fingerprint fingerprint(AuthoritySet set) {
        List<byte[]> keys = set.getMembers().stream().map(AuthorityKey::getBytes).toList();
        return Sha.sha256(keys);
    }

    /**
     * True iff there is no previous fingerprint, or the fingerprint or length differs.
     */
    public boolean changed(Fingerprint prevFingerprint, int prevLen, Fingerprint newFingerprint, int newLen) {
        return prevFingerprint == null
            || !Objects.equals(prevFingerprint, newFingerprint)
            || prevLen != newLen;
    }

    public boolean contains(AuthoritySet set, ValidatorIdentity identity) {
        return set.getMembers().stream().anyMatch(identity::matches);
    }
}
