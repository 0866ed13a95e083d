package io.github.sachinnimbal.filmes.core.enums;

public enum StorageType {
    MEMORY,
    JPA
}
