package com.example.aurawatch.service;

import java.util.List;

/**
 * Names of the files in the node keystore.
 */
public interface KeystoreDirectory {

    List<String> listFileNames();
}
