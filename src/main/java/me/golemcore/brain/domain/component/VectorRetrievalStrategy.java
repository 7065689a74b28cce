package me.golemcore.brain.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.brain.domain.model.ResultSource;
import me.golemcore.brain.domain.model.VectorHit;

import java.util.List;

/**
 * One tier of scored retrieval. The router tries the semantic strategy first
 * and falls back to the lexical one.
 */
public interface VectorRetrievalStrategy extends Component {

    /**
     * Tag attached to results produced by this strategy.
     */
    ResultSource source();

    /**
     * Scored hits for the text, best first.
     *
     * @throws me.golemcore.brain.domain.model.VectorBackendUnavailableException
     *             when the strategy cannot serve the request
     */
    List<VectorHit> search(String text, int limit);
}
