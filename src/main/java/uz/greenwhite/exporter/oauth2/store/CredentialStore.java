package uz.greenwhite.exporter.oauth2.store;

import uz.greenwhite.exporter.oauth2.model.Credential;

import java.util.Optional;

public interface CredentialStore {

    /**
     * Load the persisted credential. Missing, empty or unreadable state is reported as empty,
     * never as an exception.
     */
    Optional<Credential> load();

    /**
     * Atomically replace the persisted credential.
     *
     * @throws uz.greenwhite.exporter.oauth2.exception.CredentialStoreException if the write fails;
     *         the previous file is left intact in that case
     */
    void save(Credential credential);

    /**
     * Remove the persisted credential so the next start boots unauthenticated.
     */
    void clear();
}
