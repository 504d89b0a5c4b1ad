package cloud.vaultloader.sdk.auth;

import cloud.vaultloader.sdk.VaultLoaderException;

/**
 * Contract for obtaining the credential used to read secrets.
 */
@FunctionalInterface
public interface AuthProvider {

    AuthToken token() throws VaultLoaderException;
}
