package org.carball.srql.error;

public class UnknownEntityException extends SrqlException {

    public UnknownEntityException(String entity) {
        super(ErrorKind.UNKNOWN_ENTITY, "unsupported entity '" + entity + "'");
    }
}
