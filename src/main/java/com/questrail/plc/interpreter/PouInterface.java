package com.questrail.plc.interpreter;

import com.questrail.plc.ast.PouType;
import com.questrail.plc.ast.Program;
import com.questrail.plc.ast.VarBlock;
import com.questrail.plc.ast.VarScope;
import com.questrail.plc.ast.VariableDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The parameter lists of a FUNCTION or FUNCTION_BLOCK, in declaration order.
 * {@code members} is every name the body may refer to as its own, including
 * IN_OUT parameters and, for functions, the function's own name (the result).
 */
public record PouInterface(Program pou,
                           List<String> inputs,
                           List<String> outputs,
                           List<String> inOuts,
                           Set<String> members)
{
    public PouInterface {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        inOuts = List.copyOf(inOuts);
        members = Set.copyOf(members);
    }

    static PouInterface of(Program pou) {
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        List<String> inOuts = new ArrayList<>();
        Set<String> members = new LinkedHashSet<>();

        for (VarBlock block : pou.varBlocks()) {
            for (VariableDeclaration decl : block.declarations()) {
                for (String name : decl.names()) {
                    members.add(name);
                    if (block.scope() == VarScope.VAR_INPUT) {
                        inputs.add(name);
                    } else if (block.scope() == VarScope.VAR_OUTPUT) {
                        outputs.add(name);
                    } else if (block.scope() == VarScope.VAR_IN_OUT) {
                        inOuts.add(name);
                    }
                }
            }
        }
        if (pou.pouType() == PouType.FUNCTION) {
            members.add(pou.name());
        }
        return new PouInterface(pou, inputs, outputs, inOuts, members);
    }

    /** The declared spelling of a parameter, matched case-insensitively. */
    public Optional<String> parameter(String name) {
        for (List<String> group : List.of(inputs, inOuts, outputs)) {
            for (String candidate : group) {
                if (candidate.equalsIgnoreCase(name)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    public boolean isInput(String parameter) {
        return inputs.contains(parameter);
    }

    public boolean isInOut(String parameter) {
        return inOuts.contains(parameter);
    }

    public boolean isOutput(String parameter) {
        return outputs.contains(parameter);
    }
}
