package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.components.Component;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Component to handle the configuration and usage of our database. The stores built on it work with plain BSON
 * documents, so no codec registry beyond the driver's default is needed.
 */
public class AuthDB implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(AuthDB.class);

    private final MongoDatabase database;

    public AuthDB (Config config) {
        MongoClient mongoClient;
        if (config.databaseUri() != null) {
            LOG.info("Connecting to remote MongoDB instance...");
            mongoClient = MongoClients.create(config.databaseUri());
        } else {
            LOG.info("Connecting to local MongoDB instance...");
            mongoClient = MongoClients.create();
        }
        // Request that the JVM clean up database connections in all cases - exiting cleanly or by being terminated.
        Runtime.getRuntime().addShutdownHook(new Thread(mongoClient::close));
        database = mongoClient.getDatabase(config.databaseName());
    }

    /** Sharing a MongoCollection across threads is safe, the driver pools connections underneath it. */
    public MongoCollection<Document> getBsonCollection (String name) {
        return database.getCollection(name);
    }

    /**
     * Interface to supply configuration to this component.
     */
    public interface Config {
        default String databaseUri () {
            return "mongodb://127.0.0.1:27017";
        }

        default String databaseName () {
            return "tracking-auth";
        }
    }

}
