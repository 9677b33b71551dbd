package awstempcreds.sts.auth;

import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsServiceClientConfiguration;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory STS that answers AssumeRole with queued results and records every request.
 */
class FakeStsClient implements StsClient {

    private final Deque<Object> results = new ArrayDeque<>();
    private final List<AssumeRoleRequest> requests = new ArrayList<>();
    private boolean closed;

    FakeStsClient willReturn(String accessKeyId, String secretAccessKey, String sessionToken, Instant expiration) {
        results.add(Credentials.builder()
                .accessKeyId(accessKeyId)
                .secretAccessKey(secretAccessKey)
                .sessionToken(sessionToken)
                .expiration(expiration)
                .build());
        return this;
    }

    FakeStsClient willFail(RuntimeException failure) {
        results.add(failure);
        return this;
    }

    List<AssumeRoleRequest> getRequests() {
        return requests;
    }

    int callCount() {
        return requests.size();
    }

    AssumeRoleRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public AssumeRoleResponse assumeRole(AssumeRoleRequest assumeRoleRequest) {
        requests.add(assumeRoleRequest);
        Object next = results.poll();
        if (next == null) {
            throw new AssertionError("Unexpected AssumeRole call: " + assumeRoleRequest);
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return AssumeRoleResponse.builder().credentials((Credentials) next).build();
    }

    @Override
    public StsServiceClientConfiguration serviceClientConfiguration() {
        throw new UnsupportedOperationException();
    }

    @Override
    public String serviceName() {
        return SERVICE_NAME;
    }

    @Override
    public void close() {
        closed = true;
    }
}
