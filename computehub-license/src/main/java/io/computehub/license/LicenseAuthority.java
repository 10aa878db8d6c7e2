package io.computehub.license;

/**
 * Client view of the license server that owns the activation ledger.
 *
 * <p>The ledger binds each key to at most one installation. Implementations translate
 * these calls to a transport; every "could not get an answer" case (network failure,
 * timeout, server error, unparsable reply) surfaces as
 * {@link AuthorityUnavailableException} so callers can apply their offline policy.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link HttpLicenseAuthority} - the ComputeHub license server over HTTP</li>
 *   <li>{@link UnconfiguredAuthority} - used when no server is configured</li>
 * </ul>
 */
public interface LicenseAuthority {

    /**
     * Bind a key to an installation.
     *
     * <p>Binding a key to the installation it is already bound to succeeds again
     * without changing the ledger.
     *
     * @param licenseKey the normalized key
     * @param identity the requesting installation
     * @return the server's decision
     * @throws AuthorityUnavailableException if no answer could be obtained
     */
    BindResult bind(LicenseKey licenseKey, InstallationIdentity identity) throws AuthorityUnavailableException;

    /**
     * Release the binding between a key and an installation.
     *
     * @param licenseKey the normalized key
     * @param installationId the installation releasing the key
     * @return {@code OK}, or {@code NOT_BOUND} if there was nothing to release
     * @throws AuthorityUnavailableException if no answer could be obtained
     */
    UnbindOutcome unbind(LicenseKey licenseKey, String installationId) throws AuthorityUnavailableException;

    /**
     * Ask where a key is currently bound, relative to {@code installationId}.
     *
     * @throws AuthorityUnavailableException if no answer could be obtained
     */
    BindingState verify(LicenseKey licenseKey, String installationId) throws AuthorityUnavailableException;

    /**
     * Get the authority name for display/logging.
     */
    String getName();
}
