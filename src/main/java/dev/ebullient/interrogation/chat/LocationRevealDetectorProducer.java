package dev.ebullient.interrogation.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.quarkus.logging.Log;

@ApplicationScoped
public class LocationRevealDetectorProducer {

    @ConfigProperty(name = "interrogation.location-detector", defaultValue = "heuristic")
    String strategy;

    @Inject
    Instance<HeuristicLocationRevealDetector> heuristic;

    @Inject
    Instance<ClassifierLocationRevealDetector> classifier;

    @Produces
    @Singleton
    LocationRevealDetector locationRevealDetector() {
        if ("classifier".equalsIgnoreCase(strategy.trim())) {
            Log.infof("Using language model location reveal classifier");
            return classifier.get();
        }
        Log.infof("Using heuristic location reveal detector");
        return heuristic.get();
    }
}
