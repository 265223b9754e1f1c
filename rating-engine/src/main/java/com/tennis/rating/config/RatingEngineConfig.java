package com.tennis.rating.config;

import com.tennis.rating.engine.Blender;
import com.tennis.rating.engine.Evaluator;
import com.tennis.rating.engine.FormTracker;
import com.tennis.rating.engine.MarginFunction;
import com.tennis.rating.engine.Predictor;
import com.tennis.rating.engine.RatingModel;
import com.tennis.rating.engine.RatingRunner;
import com.tennis.rating.engine.TemporalSplitter;
import com.tennis.rating.engine.TierWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the validated rating components from {@link RatingProperties}.
 * An invalid tunable fails application startup with a configuration error.
 */
@Configuration
public class RatingEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RatingEngineConfig.class);

    @Bean
    public RatingModel ratingModel(RatingProperties properties) {
        RatingProperties.Margin margin = properties.getMargin();
        RatingProperties.Form form = properties.getForm();
        RatingProperties.Blend blend = properties.getBlend();

        RatingModel model = new RatingModel(
                properties.getDefaultRating(),
                new Predictor(properties.getScale()),
                new Blender(blend.getCurrentWeight(), blend.getFormWeight(), form.getScale(), blend.getBaselineShare()),
                new FormTracker(form.getHalfLifeDays(), form.getUpdateRate()),
                new MarginFunction(margin.getMaxMultiplier(), margin.getScale(), margin.getStraightSetsBonus()),
                new TierWeights(properties.getTierWeights())
        );

        log.info("Rating model: default={}, scale={}, tiers={}, beta={}, gamma={}, epsilon={}, form half-life={}d",
                properties.getDefaultRating(), properties.getScale(), model.tierWeights().asMap(),
                blend.getCurrentWeight(), blend.getFormWeight(), blend.getBaselineShare(), form.getHalfLifeDays());
        return model;
    }

    @Bean
    public TemporalSplitter temporalSplitter() {
        return new TemporalSplitter();
    }

    @Bean
    public Evaluator evaluator(RatingProperties properties) {
        return new Evaluator(properties.getCalibrationBuckets());
    }

    @Bean
    public RatingRunner ratingRunner(RatingModel ratingModel, TemporalSplitter temporalSplitter, Evaluator evaluator) {
        return new RatingRunner(ratingModel, temporalSplitter, evaluator);
    }
}
