package com.conveyal.trackingauth.persistence;

import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DuplicateKeyErrorTest {

    @Test
    public void onlyDuplicateKeyErrorsCountAsDuplicates () {
        assertTrue(MongoPermissionStore.isDuplicateKey(writeFailure(11000, "E11000 duplicate key error")));
        assertTrue(MongoPermissionStore.isDuplicateKey(writeFailure(11001, "E11001 duplicate key on update")));
        assertFalse(MongoPermissionStore.isDuplicateKey(writeFailure(121, "Document failed validation")));
    }

    private static MongoWriteException writeFailure (int code, String message) {
        return new MongoWriteException(new WriteError(code, message, new BsonDocument()), new ServerAddress());
    }

}
