package org.bifgen.backend.emit;

import org.bifgen.frontend.semantics.MangledSignature;
import org.bifgen.frontend.types.RestrictionKind;
import org.bifgen.model.BuiltinAttribute;
import org.bifgen.model.BuiltinEntry;
import org.bifgen.model.BuiltinStanza;
import org.bifgen.model.GeneratorModel;
import org.bifgen.model.OverloadEntry;
import org.bifgen.model.OverloadStanza;

import java.io.IOException;
import java.util.List;

/**
 * Writes the declarations artifact: the built-in, overload and instance
 * enumerations, the supporting enumerations, the table layouts with their bit
 * accessors, and one external declaration per distinct function type.
 * <p>
 * Built-ins and instances are enumerated in ascending id order, overload groups
 * in the order of their stanzas. Overload numbers start just after the built-in range.
 */
public class DeclarationsEmitter implements IArtifactEmitter {

    private static final List<String> HOST_INCLUDES =
            List.of("config.h", "system.h", "coretypes.h", "backend.h", "rtl.h", "tree.h");

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.DECLARATIONS;
    }

    @Override
    public void emit(GeneratorModel model, EmissionContext context, SourceWriter out) throws IOException {
        String p = context.options().targetPrefix();
        String pu = context.options().enumPrefix();

        out.banner(context);
        for (String include : HOST_INCLUDES) {
            out.format("#include \"%s\"", include);
        }
        out.line();

        out.format("enum %s_gen_builtins", p).line("{");
        out.format("  %s_BIF_NONE,", pu);
        for (BuiltinEntry builtin : model.builtinsById()) {
            out.format("  %s_BIF_%s,", pu, builtin.id());
        }
        out.format("  %s_BIF_MAX", pu).line("};").line();

        writeRestrictionEnum(out);
        writeEnableEnum(out);
        writeBifData(out, Math.max(1, context.options().maxRestrictedOperands()));
        writeAttributeBits(out);

        out.format("extern bifdata %s_builtin_info[%s_BIF_MAX];", p, pu).line();
        writeHasher(out, p + "_bif_hasher", "bifdata", "bif_hash");

        out.format("enum %s_gen_overloads", p).line("{");
        out.format("  %s_OVLD_NONE = %s_BIF_MAX + 1,", pu, pu);
        for (OverloadStanza stanza : model.overloadStanzas()) {
            out.format("  %s_OVLD_%s,", pu, stanza.groupId());
        }
        out.format("  %s_OVLD_MAX", pu).line("};").line();

        out.format("enum %s_gen_instances", p).line("{");
        out.format("  %s_INST_NONE,", pu);
        for (OverloadEntry overload : model.overloadsById()) {
            out.format("  %s_INST_%s,", pu, overload.overloadId());
        }
        out.format("  %s_INST_MAX", pu).line("};").line();

        out.line("struct ovlddata").line("{");
        out.line("  const char *bifname;");
        out.format("  %s_gen_builtins bifid;", p);
        out.format("  %s_gen_overloads ovldid;", p);
        out.line("  tree fntype;");
        out.line("  ovlddata *next;");
        out.line("};").line();

        out.format("extern ovlddata %s_overload_info[%s_INST_MAX];", p, pu).line();
        writeHasher(out, p + "_ovld_hasher", "ovlddata", "ovld_hash");

        out.format("extern void %s_init_generated_builtins ();", p).line();

        for (MangledSignature functionType : model.functionTypes()) {
            out.format("extern tree %s;", functionType.id());
        }
        out.line();
    }

    private void writeRestrictionEnum(SourceWriter out) throws IOException {
        out.line("enum restriction {");
        RestrictionKind[] kinds = RestrictionKind.values();
        for (int i = 0; i < kinds.length; i++) {
            out.format("  %s%s", kinds[i].emittedName(), i < kinds.length - 1 ? "," : "");
        }
        out.line("};").line();
    }

    private void writeEnableEnum(SourceWriter out) throws IOException {
        out.line("enum bif_enable {");
        BuiltinStanza[] stanzas = BuiltinStanza.values();
        for (int i = 0; i < stanzas.length; i++) {
            out.format("  %s%s", stanzas[i].enableTag(), i < stanzas.length - 1 ? "," : "");
        }
        out.line("};").line();
    }

    private void writeBifData(SourceWriter out, int restrictedSlots) throws IOException {
        out.line("struct bifdata").line("{");
        out.line("  const char *bifname;");
        out.line("  bif_enable enable;");
        out.line("  tree fntype;");
        out.line("  insn_code icode;");
        out.line("  int  nargs;");
        out.line("  int  bifattrs;");
        out.format("  int  restr_opnd[%d];", restrictedSlots);
        out.format("  restriction restr[%d];", restrictedSlots);
        out.format("  int  restr_val1[%d];", restrictedSlots);
        out.format("  int  restr_val2[%d];", restrictedSlots);
        out.line("};").line();
    }

    private void writeAttributeBits(SourceWriter out) throws IOException {
        for (BuiltinAttribute attribute : BuiltinAttribute.values()) {
            out.format("#define %-24s(0x%08x)", attribute.bitName(), attribute.bit());
        }
        out.line();
        for (BuiltinAttribute attribute : BuiltinAttribute.values()) {
            out.format("#define %-24s((x).bifattrs & %s)", attribute.accessorName() + "(x)", attribute.bitName());
        }
        out.line();
    }

    private void writeHasher(SourceWriter out, String hasher, String entryType, String table) throws IOException {
        out.format("struct %s : nofree_ptr_hash<%s>", hasher, entryType).line("{");
        out.line("  typedef const char *compare_type;").line();
        out.format("  static hashval_t hash (%s *);", entryType);
        out.format("  static bool equal (%s *, const char *);", entryType);
        out.line("};").line();
        out.format("extern hash_table<%s> %s;", hasher, table).line();
    }
}
