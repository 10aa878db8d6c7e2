package io.computehub.license;

/**
 * Authority used when no license server URL is configured.
 *
 * <p>Behaves as a server that is never reachable: activation fails with a
 * network-required reason and verification runs on the cached record alone.
 */
public class UnconfiguredAuthority implements LicenseAuthority {

    private static final String MESSAGE =
        "No license server configured. Set " + LicenseConfig.ENV_SERVER_URL;

    @Override
    public BindResult bind(LicenseKey licenseKey, InstallationIdentity identity)
            throws AuthorityUnavailableException {
        throw new AuthorityUnavailableException(MESSAGE);
    }

    @Override
    public UnbindOutcome unbind(LicenseKey licenseKey, String installationId)
            throws AuthorityUnavailableException {
        throw new AuthorityUnavailableException(MESSAGE);
    }

    @Override
    public BindingState verify(LicenseKey licenseKey, String installationId)
            throws AuthorityUnavailableException {
        throw new AuthorityUnavailableException(MESSAGE);
    }

    @Override
    public String getName() {
        return "None (not configured)";
    }
}
