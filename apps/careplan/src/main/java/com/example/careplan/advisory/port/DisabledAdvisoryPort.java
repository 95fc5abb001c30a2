package com.example.careplan.advisory.port;

import com.example.careplan.advisory.model.AdjudicationContext;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import reactor.core.publisher.Mono;

/**
 * Port used when no advisory model is wired in. Never has an opinion.
 */
public class DisabledAdvisoryPort implements AdvisoryPort {

    @Override
    public Mono<AdvisoryOpinion> advise(AdjudicationContext context) {
        return Mono.empty();
    }
}
