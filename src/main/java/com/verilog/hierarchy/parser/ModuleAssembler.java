package com.verilog.hierarchy.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.Instance;
import com.verilog.hierarchy.model.Port;
import com.verilog.hierarchy.model.VerilogModule;

/**
 * Turns a completed module batch into a {@link VerilogModule}: normalize once,
 * then run both extractors over the same normalized body.
 */
public class ModuleAssembler {
    private static final Logger log = LoggerFactory.getLogger(ModuleAssembler.class);

    private final BodyNormalizer normalizer;
    private final PortExtractor portExtractor;
    private final InstanceExtractor instanceExtractor;

    public ModuleAssembler() {
        this(new BodyNormalizer(), new PortExtractor(), new InstanceExtractor());
    }

    public ModuleAssembler(BodyNormalizer normalizer, PortExtractor portExtractor, InstanceExtractor instanceExtractor) {
        this.normalizer = normalizer;
        this.portExtractor = portExtractor;
        this.instanceExtractor = instanceExtractor;
    }

    public VerilogModule assemble(ModuleSource source) {
        log.debug("getting attributes for module {} ...", source.getName());

        String body = normalizer.normalize(source.getLines());
        List<Port> ports = portExtractor.extract(body);
        List<Instance> instances = instanceExtractor.extract(source.getName(), body);

        VerilogModule.VerilogModuleBuilder builder = VerilogModule.builder()
                .name(source.getName())
                .location(source.getLocation())
                .instances(instances);

        for (Port port : ports) {
            if (port.getDirection().feedsInputs()) {
                builder.input(port);
            }
            if (port.getDirection().feedsOutputs()) {
                builder.output(port);
            }
        }

        VerilogModule module = builder.build();
        if (log.isDebugEnabled()) {
            log.debug("    INPUTS        : {}", module.getInputs());
            log.debug("    OUTPUTS       : {}", module.getOutputs());
            for (Instance instance : module.getInstances()) {
                log.debug("    CALLED MODULE : instance = {}, type = {}",
                        instance.getInstanceName(), instance.getTypeName());
            }
        }
        return module;
    }
}
