package com.questrail.choreography.api;

import com.questrail.choreography.cfg.Cfg;
import com.questrail.choreography.cfg.CfgBuilder;
import com.questrail.choreography.config.SimulatorConfig;
import com.questrail.choreography.config.VerificationOptions;
import com.questrail.choreography.model.ProtocolDeclaration;
import com.questrail.choreography.model.ProtocolModule;
import com.questrail.choreography.model.SourcePosition;
import com.questrail.choreography.observability.SimulationObservabilitySink;
import com.questrail.choreography.parser.ParseException;
import com.questrail.choreography.parser.ProtocolParser;
import com.questrail.choreography.simulation.Simulator;
import com.questrail.choreography.verification.ProtocolVerifier;
import com.questrail.choreography.verification.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Choreography
 * -----------------------------------------------------------------------------
 * Entry point for editors, renderers and other tools driving the pipeline
 * <pre>
 *   text → parse → compile → { simulate, verify }
 * </pre>
 *
 * Every call is a pure transformation over its own inputs and may run
 * concurrently with other calls. Only the returned {@link Simulator} holds
 * mutable state.
 */
public final class Choreography
{
    private static final Logger log = LoggerFactory.getLogger(Choreography.class);

    private Choreography() {}

    /**
     * Parses source text holding zero or more protocol declarations.
     *
     * @throws ParseException on malformed or out-of-scope input
     */
    public static ProtocolModule parse(String source) {
        Objects.requireNonNull(source, "source");
        ProtocolModule module = new ProtocolParser(source).parseModule();
        log.debug("Parsed {} protocol declaration(s)", module.declarations().size());
        return module;
    }

    /**
     * Parses source text that must hold exactly one protocol declaration.
     *
     * @throws ParseException on malformed input, or when the text holds no or
     *                        several declarations
     */
    public static ProtocolDeclaration parseProtocol(String source) {
        ProtocolModule module = parse(source);
        if (module.declarations().size() != 1) {
            throw new ParseException("Expected exactly one protocol declaration but found "
                    + module.declarations().size(), SourcePosition.of(1, 1, 0));
        }
        return module.declarations().get(0);
    }

    public static Cfg compile(ProtocolDeclaration declaration) {
        Cfg cfg = new CfgBuilder().build(declaration);
        log.debug("Compiled protocol {} into {} nodes and {} edges",
                cfg.protocolName(), cfg.nodeCount(), cfg.edgeCount());
        return cfg;
    }

    public static VerificationReport verify(Cfg cfg) {
        return verify(cfg, VerificationOptions.defaults());
    }

    public static VerificationReport verify(Cfg cfg, VerificationOptions options) {
        VerificationReport report = new ProtocolVerifier(options).verify(cfg);
        if (report.valid()) {
            log.debug("Protocol {} verified with {} warning(s)", cfg.protocolName(), report.warnings().size());
        } else {
            log.debug("Protocol {} failed verification with {} error(s)", cfg.protocolName(), report.errors().size());
        }
        return report;
    }

    public static Simulator simulate(Cfg cfg) {
        return new Simulator(cfg);
    }

    public static Simulator simulate(Cfg cfg, SimulatorConfig config) {
        return new Simulator(cfg, config);
    }

    public static Simulator simulate(Cfg cfg, SimulatorConfig config, SimulationObservabilitySink sink) {
        return new Simulator(cfg, config, sink);
    }
}
