package tech.noetzold.zta.gateway_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersistenceStatus(boolean ok, Long id, String error) {

    public static PersistenceStatus stored(Long id) {
        return new PersistenceStatus(true, id, null);
    }

    public static PersistenceStatus failed(String error) {
        return new PersistenceStatus(false, null, error);
    }
}
