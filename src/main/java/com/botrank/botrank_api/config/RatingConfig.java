package com.botrank.botrank_api.config;

import com.botrank.botrank_api.rating.FitOptions;
import com.botrank.botrank_api.rating.Formulation;
import com.botrank.botrank_api.rating.PlackettLuceFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rating core from application properties. The formulation is a
 * configuration choice; both produce the same strengths.
 */
@Configuration
public class RatingConfig {
    private static final Logger log = LoggerFactory.getLogger(RatingConfig.class);

    @Bean
    public PlackettLuceFitter plackettLuceFitter(
            @Value("${botrank.rating.formulation:reference}") String formulation) {
        PlackettLuceFitter fitter = Formulation.fromProperty(formulation).newFitter();
        log.info("Using the {} Plackett-Luce formulation", fitter.formulation());
        return fitter;
    }

    @Bean
    public FitOptions fitOptions(
            @Value("${botrank.rating.tolerance:1e-9}") double tolerance,
            @Value("${botrank.rating.check-precondition:true}") boolean checkPrecondition,
            @Value("${botrank.rating.normalize:true}") boolean normalize,
            @Value("${botrank.rating.max-iterations:0}") int maxIterations,
            @Value("${botrank.rating.verbose:false}") boolean verbose) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }
}
