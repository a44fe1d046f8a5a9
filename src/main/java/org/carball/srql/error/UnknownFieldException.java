package org.carball.srql.error;

public class UnknownFieldException extends SrqlException {

    public UnknownFieldException(String entity, String field) {
        super(ErrorKind.UNKNOWN_FIELD, "field '" + field + "' is not available for entity '" + entity + "'");
    }
}
