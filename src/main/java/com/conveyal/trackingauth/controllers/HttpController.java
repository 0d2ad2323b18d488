package com.conveyal.trackingauth.controllers;

/**
 * All of our classes defining HTTP API endpoints implement this interface.
 * It has a single method that registers all the endpoints.
 * Each controller implementation should have a constructor taking all the application Components it needs as
 * arguments. Authorization has already happened in a before-filter by the time any of these endpoints is reached.
 */
public interface HttpController {

    void registerEndpoints (spark.Service sparkService);

}
