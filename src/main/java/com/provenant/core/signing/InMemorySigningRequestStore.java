package com.provenant.core.signing;

import com.provenant.core.model.SigningRequest;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySigningRequestStore implements SigningRequestStore {

    private final ConcurrentHashMap<String, StoredRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void save(SigningRequest request, long artifactSize) {
        requests.put(request.requestId(), new StoredRequest(request, artifactSize));
    }

    @Override
    public List<StoredRequest> loadAll() {
        return requests.values().stream()
                .sorted(Comparator.comparing((StoredRequest s) -> s.request().createdAt())
                        .thenComparing(s -> s.request().requestId()))
                .toList();
    }
}
