package com.example.careplan.advisory.port;

import com.example.careplan.advisory.model.AdjudicationContext;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import reactor.core.publisher.Mono;

/**
 * Source of a second opinion on the care tier. Completing empty means no opinion.
 */
public interface AdvisoryPort {

    Mono<AdvisoryOpinion> advise(AdjudicationContext context);
}
