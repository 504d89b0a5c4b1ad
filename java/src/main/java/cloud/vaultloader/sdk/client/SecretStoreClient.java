package cloud.vaultloader.sdk.client;

import cloud.vaultloader.sdk.VaultLoaderException;

/**
 * Contract for reading secrets from the store with the credential most recently applied.
 */
public interface SecretStoreClient {

    /**
     * Applies the credential used by subsequent {@link #read(String)} calls.
     */
    void setToken(String token);

    LeasedSecret read(String path) throws VaultLoaderException;
}
