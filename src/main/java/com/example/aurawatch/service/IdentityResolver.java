package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.IdentityException;
import com.example.aurawatch.model.AuthorityKey;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.rpc.ChainRpc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the operator's consensus key in the keystore and checks that the node holds it.
 *
 * Keystore file names are {@code <4-byte key type><32-byte public key>} in hex,
 * so an Aura key is a file named {@code 61757261} followed by 64 hex characters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final MonitorConfig config;
    private final KeystoreDirectory keystore;
    private final ChainRpc chainRpc;

    public ValidatorIdentity resolve() {
        return resolve(keystore.listFileNames());
    }

    /**
     * Exactly one distinct matching file name is required; the resolver never picks one of several.
     */
    public ValidatorIdentity resolve(List<String> fileNames) {
        Pattern pattern = Pattern.compile("^" + config.keyTypeTag() + "([0-9a-f]{64})$");
        SortedSet<String> found = new TreeSet<>();

        for (String name : fileNames) {
            Matcher m = pattern.matcher(normalize(name));
            if (m.matches()) {
                found.add("0x" + m.group(1));
            }
        }

        if (found.isEmpty()) {
            throw new IdentityException(ErrorCode.NO_KEY_FOUND, String.format(
                "no key found in keystore '%s': expected a file named like %s<pubkey32bytes> (hex)",
                config.getKeystorePath(), config.keyTypeTag()));
        }
        if (found.size() > 1) {
            throw new IdentityException(ErrorCode.AMBIGUOUS_IDENTITY, String.format(
                "ambiguous identity: multiple %s keys found in keystore '%s': %s. "
                    + "Keep only one key, or use a dedicated keystore path.",
                config.getKeyType(), config.getKeystorePath(), found));
        }

        ValidatorIdentity identity = new ValidatorIdentity(AuthorityKey.fromHex(found.first()), config.getKeyType());
        log.info("Detected {} key {} in keystore", identity.getKeyType(), identity.toHex());
        return identity;
    }

    /**
     * Fails closed unless the node reports holding the key for the consensus role.
     */
    public void confirm(ValidatorIdentity identity) {
        if (!chainRpc.hasKey(identity.toHex(), identity.getKeyType())) {
            throw new IdentityException(ErrorCode.KEY_NOT_ON_NODE, String.format(
                "Refusing to run: detected %s key %s is not present in this node's keystore (author_hasKey=false).",
                identity.getKeyType(), identity.toHex()));
        }
        log.info("Node confirmed it holds {} key {}", identity.getKeyType(), identity.toHex());
    }

    static String normalize(String fileName) {
        String s = fileName.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("0x") ? s.substring(2) : s;
    }
}
