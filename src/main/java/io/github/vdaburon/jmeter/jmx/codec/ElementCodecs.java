/*
 * Copyright 2024 Vincent DABURON
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */


package io.github.vdaburon.jmeter.jmx.codec;

import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The codec table : find the codec of a tag by its testclass to read it, and the codec of an element by its kind to write it.
 * Adding a kind to the library is one model class, one codec and one call to {@link #register(ElementCodec)}.
 * <p>
 * A registry is not synchronized, fill it before sharing it between threads.
 */
public class ElementCodecs {

    private static final Logger LOGGER = Logger.getLogger(ElementCodecs.class.getName());

    private final Map<String, ElementCodec<? extends PlanElement>> mapByDiscriminator = new LinkedHashMap<>();
    private final Map<ElementKind, ElementCodec<? extends PlanElement>> mapByKind = new EnumMap<>(ElementKind.class);

    /**
     * @return a new registry holding the codecs of all the kinds of {@link ElementKind}
     */
    public static ElementCodecs defaults() {
        ElementCodecs codecs = new ElementCodecs();
        codecs.register(new TestPlanCodec());
        codecs.register(new ThreadGroupCodec(ElementKind.THREAD_GROUP));
        codecs.register(new ThreadGroupCodec(ElementKind.SETUP_THREAD_GROUP));
        codecs.register(new ThreadGroupCodec(ElementKind.POST_THREAD_GROUP));
        codecs.register(new HttpSamplerCodec());
        codecs.register(new Jsr223Codec(ElementKind.JSR223_SAMPLER));
        codecs.register(new HttpDefaultsCodec());
        codecs.register(new HeaderManagerCodec());
        codecs.register(new ArgumentsCodec());
        codecs.register(new CookieManagerCodec());
        codecs.register(new CacheManagerCodec());
        codecs.register(new CsvDataSetCodec());
        codecs.register(new Jsr223Codec(ElementKind.JSR223_PRE_PROCESSOR));
        codecs.register(new RegexExtractorCodec());
        codecs.register(new JsonExtractorCodec());
        codecs.register(new BoundaryExtractorCodec());
        codecs.register(new Jsr223Codec(ElementKind.JSR223_POST_PROCESSOR));
        codecs.register(new ResponseAssertionCodec());
        codecs.register(new DurationAssertionCodec());
        codecs.register(new JsonAssertionCodec());
        codecs.register(new BeanShellAssertionCodec());
        codecs.register(new LoopControllerCodec());
        codecs.register(new IfControllerCodec());
        codecs.register(new WhileControllerCodec());
        codecs.register(new TransactionControllerCodec());
        codecs.register(new TestActionCodec());
        codecs.register(new ConstantTimerCodec());
        codecs.register(new UniformRandomTimerCodec());
        codecs.register(new ConstantThroughputTimerCodec());
        codecs.register(new ResultCollectorCodec());
        return codecs;
    }

    /**
     * Add a codec, it replaces the codec already registered for the same discriminator and for the same kind
     * @param codec the codec
     * @return this registry
     */
    public ElementCodecs register(ElementCodec<? extends PlanElement> codec) {
        Objects.requireNonNull(codec, "codec");
        mapByDiscriminator.put(codec.discriminator(), codec);
        mapByKind.put(codec.kind(), codec);
        LOGGER.fine("register codec discriminator=" + codec.discriminator() + ", kind=" + codec.kind());
        return this;
    }

    /**
     * @param discriminator the testclass of the tag (or the tag name when the tag has no testclass)
     * @return the codec, null if the kind is unknown
     */
    public ElementCodec<? extends PlanElement> forDiscriminator(String discriminator) {
        return mapByDiscriminator.get(discriminator);
    }

    /**
     * @param kind the kind of the element to write
     * @return the codec
     * @throws IllegalStateException if no codec is registered for this kind
     */
    @SuppressWarnings("unchecked")
    public ElementCodec<PlanElement> forKind(ElementKind kind) {
        ElementCodec<? extends PlanElement> codec = mapByKind.get(kind);
        if (codec == null) {
            throw new IllegalStateException("No codec registered for the kind " + kind);
        }
        return (ElementCodec<PlanElement>) codec;
    }

    public boolean isKnown(String discriminator) {
        return mapByDiscriminator.containsKey(discriminator);
    }

    public Collection<ElementCodec<? extends PlanElement>> getCodecs() {
        return Collections.unmodifiableCollection(mapByKind.values());
    }
}
