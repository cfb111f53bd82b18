package com.nsguard.webhook.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable view of one inbound admission request, built once from the
 * decoded wire envelope and never mutated afterwards.
 *
 * @param uid               request UID, echoed back in the response
 * @param operation         CREATE, UPDATE, DELETE or CONNECT
 * @param resource          the API collection being mutated
 * @param name              name of the target object
 * @param namespace         namespace of the target object (empty for namespaces themselves)
 * @param requesterIdentity username of the caller, for logging only
 * @param rawObject         the serialized object carried by the request, possibly empty
 */
public record ReviewRequest(
        String               uid,
        Operation            operation,
        GroupVersionResource resource,
        String               name,
        String               namespace,
        String               requesterIdentity,
        byte[]               rawObject
) {
    public ReviewRequest {
        rawObject = rawObject == null ? new byte[0] : rawObject.clone();
    }

    @Override
    public byte[] rawObject() {
        return rawObject.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewRequest other)) return false;
        return Objects.equals(uid, other.uid)
                && operation == other.operation
                && Objects.equals(resource, other.resource)
                && Objects.equals(name, other.name)
                && Objects.equals(namespace, other.namespace)
                && Objects.equals(requesterIdentity, other.requesterIdentity)
                && Arrays.equals(rawObject, other.rawObject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, operation, resource, name, namespace, requesterIdentity)
                * 31 + Arrays.hashCode(rawObject);
    }

    @Override
    public String toString() {
        return "ReviewRequest{uid=" + uid + ", operation=" + operation + ", resource=" + resource
                + ", name=" + name + ", namespace=" + namespace
                + ", requester=" + requesterIdentity + ", rawObject=" + rawObject.length + " bytes}";
    }
}
