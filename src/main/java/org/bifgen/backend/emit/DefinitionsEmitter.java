package org.bifgen.backend.emit;

import org.bifgen.frontend.semantics.MangledSignature;
import org.bifgen.frontend.semantics.Mangler;
import org.bifgen.frontend.types.RestrictedOperand;
import org.bifgen.model.BuiltinEntry;
import org.bifgen.model.GeneratorModel;
import org.bifgen.model.OverloadEntry;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes the definitions artifact: the function type variables, the two info
 * tables with their hash tables, and the initialization function that fills them.
 * <p>
 * Built-ins are initialized in file order. Overload instances are initialized
 * chain by chain; each instance links to the next one with the same name and the
 * head of every chain is entered into the overload hash table.
 */
public class DefinitionsEmitter implements IArtifactEmitter {

    private static final List<String> HOST_INCLUDES = List.of(
            "config.h", "system.h", "coretypes.h", "backend.h", "rtl.h", "tree.h",
            "langhooks.h", "insn-codes.h");

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.DEFINITIONS;
    }

    @Override
    public void emit(GeneratorModel model, EmissionContext context, SourceWriter out) throws IOException {
        String p = context.options().targetPrefix();
        String pu = context.options().enumPrefix();

        out.banner(context);
        for (String include : HOST_INCLUDES) {
            out.format("#include \"%s\"", include);
        }
        out.format("#include \"%s\"", context.declarationsInclude());
        out.line();

        for (MangledSignature functionType : model.functionTypes()) {
            out.format("tree %s;", functionType.id());
        }
        out.line();

        out.format("bifdata %s_builtin_info[%s_BIF_MAX];", p, pu);
        out.format("ovlddata %s_overload_info[%s_INST_MAX];", p, pu).line();

        writeHasherBodies(out, p + "_bif_hasher", "bifdata");
        writeHasherBodies(out, p + "_ovld_hasher", "ovlddata");
        out.format("hash_table<%s_bif_hasher> bif_hash (1024);", p);
        out.format("hash_table<%s_ovld_hasher> ovld_hash (1024);", p).line();

        out.line("void");
        out.format("%s_init_generated_builtins ()", p);
        out.line("{");
        out.line("  tree t;");
        out.line("  bifdata *bifaddr;");
        out.line("  ovlddata *oaddr;");
        out.line("  hashval_t hash;");
        out.line("  bifdata **bslot;");
        out.line("  ovlddata **oslot;").line();

        for (MangledSignature functionType : model.functionTypes()) {
            writeFunctionTypeInit(out, functionType);
        }
        out.line();

        for (BuiltinEntry builtin : model.builtins()) {
            writeBuiltinInit(out, p, pu, builtin);
        }

        for (Map.Entry<String, List<OverloadEntry>> chain : model.overloadChains().entrySet()) {
            writeOverloadChainInit(out, p, pu, chain.getKey(), chain.getValue());
        }
        out.line("}");
    }

    private void writeHasherBodies(SourceWriter out, String hasher, String entryType) throws IOException {
        out.line("hashval_t");
        out.format("%s::hash (%s *bd)", hasher, entryType);
        out.line("{");
        out.line("  return htab_hash_string (bd->bifname);");
        out.line("}").line();
        out.line("bool");
        out.format("%s::equal (%s *bd, const char *name)", hasher, entryType);
        out.line("{");
        out.line("  return bd && name && !strcmp (bd->bifname, name);");
        out.line("}").line();
    }

    private void writeFunctionTypeInit(SourceWriter out, MangledSignature functionType) throws IOException {
        String guard = TypeNodeNames.guardFor(functionType);
        String indent = "  ";
        if (guard != null) {
            out.format("  %s = NULL_TREE;", functionType.id());
            out.format("  if (%s)", guard);
            indent = "    ";
        }
        StringBuilder call = new StringBuilder();
        call.append(indent).append(functionType.id()).append("\n").append(indent).append("  = build_function_type_list (")
                .append(TypeNodeNames.nodeFor(functionType.returnFragment()));
        for (String arg : functionType.argFragments()) {
            call.append(",\n").append(indent).append("\t\t\t\t").append(TypeNodeNames.nodeFor(arg));
        }
        call.append(", NULL_TREE);");
        out.line(call.toString());
    }

    private void writeBuiltinInit(SourceWriter out, String p, String pu, BuiltinEntry builtin) throws IOException {
        String slot = String.format("%s_builtin_info[%s_BIF_%s]", p, pu, builtin.id());
        String name = builtin.prototype().name();
        String fntype = builtin.typeDescId();

        out.format("  %s.bifname = \"%s\";", slot, name);
        out.format("  %s.enable = %s;", slot, builtin.stanza().enableTag());
        out.format("  %s.fntype = %s;", slot, fntype);
        out.format("  %s.nargs = %d;", slot, builtin.prototype().argCount());
        out.format("  %s.icode = CODE_FOR_%s;", slot, builtin.patternName());
        out.format("  %s.bifattrs = %s;", slot, builtin.attributes().maskExpression());
        List<RestrictedOperand> restricted = builtin.prototype().restrictedOperands();
        for (int i = 0; i < restricted.size(); i++) {
            RestrictedOperand operand = restricted.get(i);
            out.format("  %s.restr_opnd[%d] = %d;", slot, i, operand.operand());
            out.format("  %s.restr[%d] = %s;", slot, i, operand.restriction().kind().emittedName());
            out.format("  %s.restr_val1[%d] = %d;", slot, i, operand.restriction().value1());
            out.format("  %s.restr_val2[%d] = %d;", slot, i, operand.restriction().value2());
        }
        out.format("  bifaddr = &%s;", slot);
        out.format("  hash = %s_bif_hasher::hash (bifaddr);", p);
        out.format("  bslot = bif_hash.find_slot_with_hash (\"%s\", hash, INSERT);", name);
        out.line("  *bslot = bifaddr;");

        String guard = TypeNodeNames.guardFor(Mangler.mangle(builtin.prototype()));
        String condition = builtin.stanza().condition();
        if (guard != null) {
            condition = condition + " && " + fntype;
        }
        out.format("  if (%s)", condition);
        out.line("    {");
        out.format("      t = add_builtin_function (\"%s\", %s, (int) %s_BIF_%s, BUILT_IN_MD, NULL, NULL_TREE);",
                name, fntype, pu, builtin.id());
        switch (builtin.kind()) {
            case CONST -> {
                out.line("      TREE_READONLY (t) = 1;");
                out.line("      TREE_NOTHROW (t) = 1;");
            }
            case PURE -> {
                out.line("      DECL_PURE_P (t) = 1;");
                out.line("      TREE_NOTHROW (t) = 1;");
            }
            case FPMATH -> {
                out.line("      TREE_NOTHROW (t) = 1;");
                out.line("      if (flag_rounding_math)");
                out.line("        {");
                out.line("          DECL_PURE_P (t) = 1;");
                out.line("          DECL_IS_NOVOPS (t) = 1;");
                out.line("        }");
                out.line("      else");
                out.line("        TREE_READONLY (t) = 1;");
            }
            case NONE -> {
            }
        }
        out.line("    }").line();
    }

    private void writeOverloadChainInit(SourceWriter out, String p, String pu, String name, List<OverloadEntry> chain)
            throws IOException {
        for (int i = 0; i < chain.size(); i++) {
            OverloadEntry overload = chain.get(i);
            String slot = String.format("%s_overload_info[%s_INST_%s]", p, pu, overload.overloadId());
            out.format("  %s.bifname = \"%s\";", slot, name);
            out.format("  %s.bifid = %s_BIF_%s;", slot, pu, overload.builtinId());
            out.format("  %s.ovldid = %s_OVLD_%s;", slot, pu, overload.stanza().groupId());
            out.format("  %s.fntype = %s;", slot, overload.typeDescId());
            if (i + 1 < chain.size()) {
                out.format("  %s.next = &%s_overload_info[%s_INST_%s];", slot, p, pu, chain.get(i + 1).overloadId());
            } else {
                out.format("  %s.next = NULL;", slot);
            }
            if (i == 0) {
                out.format("  oaddr = &%s;", slot);
                out.format("  hash = %s_ovld_hasher::hash (oaddr);", p);
                out.format("  oslot = ovld_hash.find_slot_with_hash (\"%s\", hash, INSERT);", name);
                out.line("  *oslot = oaddr;");
            }
            out.line();
        }
    }
}
