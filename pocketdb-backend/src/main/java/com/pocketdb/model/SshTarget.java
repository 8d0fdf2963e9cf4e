package com.pocketdb.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Remote login used to reach a backend through an SSH port forward.
 */
@Data
@Builder
public class SshTarget {
    private String host;
    @Builder.Default
    private int port = 22;
    private String username;
    @ToString.Exclude
    private String password;

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}
