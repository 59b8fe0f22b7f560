package io.kitchensync.core.store;

import io.kitchensync.core.job.LinkedAccount;
import io.kitchensync.core.job.SyncEndpoint;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface AccountStore {
    void saveAccount(LinkedAccount account) throws IOException;

    Optional<LinkedAccount> findAccount(String accountId) throws IOException;

    boolean saveAuthBundle(String accountId, String authBundle) throws IOException;

    void saveEndpoint(SyncEndpoint endpoint) throws IOException;

    Optional<SyncEndpoint> findEndpoint(String endpointId) throws IOException;

    List<SyncEndpoint> listEndpoints(String accountId) throws IOException;
}
