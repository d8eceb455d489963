package org.bifgen.backend.emit;

import org.bifgen.model.GeneratorModel;
import org.bifgen.model.OverloadEntry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DefinitionsEmitter}.
 * These tests render small models and check the initialization code fragment by fragment.
 */
@Tag("unit")
public class DefinitionsEmitterTest {

    private static final String BUILTINS = String.join("\n",
            "[altivec]",
            "  const vsi __builtin_altivec_vaddsws (vsi, vsi);",
            "    VADDSWS altivec_vaddsws {}",
            "  vui __builtin_altivec_vadduwm (vui, vui);",
            "    VADDUWM addv4si3 {}",
            "  vsi __builtin_altivec_vspltw (vsi, const int<2>);",
            "    VSPLTW altivec_vspltw {}",
            "[ieee128-hw]",
            "  fpmath _Float128 __builtin_sqrtf128 (_Float128);",
            "    SQRTF128 sqrtkf2 {}");

    private static final String OVERLOADS = String.join("\n",
            "[VEC_ADDS, vec_adds, __builtin_vec_adds]",
            "  vsi __builtin_vec_adds (vsi, vsi);",
            "    VADDSWS",
            "  vui __builtin_vec_adds (vui, vui);",
            "    VADDUWM");

    private static String render() throws Exception {
        GeneratorModel model = TestModels.model(BUILTINS, OVERLOADS);
        return TestModels.render(new DefinitionsEmitter(), model);
    }

    @Test
    void includesTheDeclarations() throws Exception {
        String text = render();

        assertThat(text).contains("#include \"insn-codes.h\"\n#include \"rs6000-builtins.h\"\n");
        assertThat(text).contains("bifdata rs6000_builtin_info[RS6000_BIF_MAX];");
        assertThat(text).contains("hash_table<rs6000_ovld_hasher> ovld_hash (1024);");
    }

    /**
     * Verifies that every function type is defined once and built from its fragments.
     */
    @Test
    void buildsEachFunctionTypeOnce() throws Exception {
        String text = render();

        assertThat(text).containsOnlyOnce("tree v4si_ftype_v4si_v4si;");
        assertThat(text).contains(String.join("\n",
                "  uv4si_ftype_uv4si_uv4si",
                "    = build_function_type_list (unsigned_V4SI_type_node,",
                "  \t\t\t\tunsigned_V4SI_type_node,",
                "  \t\t\t\tunsigned_V4SI_type_node, NULL_TREE);"));
    }

    /**
     * Verifies that a function type over an optional type node is only built when the node exists.
     */
    @Test
    void guardsOptionalTypeNodes() throws Exception {
        String text = render();

        assertThat(text).contains(String.join("\n",
                "  tf_ftype_tf = NULL_TREE;",
                "  if (float128_type_node)",
                "    tf_ftype_tf",
                "      = build_function_type_list (float128_type_node,"));
        assertThat(text).contains("  if (TARGET_FLOAT128_HW && tf_ftype_tf)");
    }

    /**
     * Verifies the table slot, the hash insertion and the gated registration of a const built-in.
     */
    @Test
    void initializesBuiltinSlot() throws Exception {
        String text = render();

        assertThat(text).contains(String.join("\n",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].bifname = \"__builtin_altivec_vaddsws\";",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].enable = ENB_ALTIVEC;",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].fntype = v4si_ftype_v4si_v4si;",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].nargs = 2;",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].icode = CODE_FOR_altivec_vaddsws;",
                "  rs6000_builtin_info[RS6000_BIF_VADDSWS].bifattrs = 0;",
                "  bifaddr = &rs6000_builtin_info[RS6000_BIF_VADDSWS];",
                "  hash = rs6000_bif_hasher::hash (bifaddr);",
                "  bslot = bif_hash.find_slot_with_hash (\"__builtin_altivec_vaddsws\", hash, INSERT);",
                "  *bslot = bifaddr;",
                "  if (TARGET_ALTIVEC)",
                "    {",
                "      t = add_builtin_function (\"__builtin_altivec_vaddsws\", v4si_ftype_v4si_v4si, "
                        + "(int) RS6000_BIF_VADDSWS, BUILT_IN_MD, NULL, NULL_TREE);",
                "      TREE_READONLY (t) = 1;",
                "      TREE_NOTHROW (t) = 1;",
                "    }"));
    }

    @Test
    void recordsRestrictedOperands() throws Exception {
        String text = render();

        assertThat(text).contains(String.join("\n",
                "  rs6000_builtin_info[RS6000_BIF_VSPLTW].restr_opnd[0] = 2;",
                "  rs6000_builtin_info[RS6000_BIF_VSPLTW].restr[0] = RES_BITS;",
                "  rs6000_builtin_info[RS6000_BIF_VSPLTW].restr_val1[0] = 2;",
                "  rs6000_builtin_info[RS6000_BIF_VSPLTW].restr_val2[0] = 0;"));
    }

    /**
     * Verifies the purity flags of an fpmath built-in and that a plain built-in gets none.
     */
    @Test
    void purityFlagsFollowTheKind() throws Exception {
        String text = render();

        assertThat(text).contains(String.join("\n",
                "      TREE_NOTHROW (t) = 1;",
                "      if (flag_rounding_math)",
                "        {",
                "          DECL_PURE_P (t) = 1;",
                "          DECL_IS_NOVOPS (t) = 1;",
                "        }",
                "      else",
                "        TREE_READONLY (t) = 1;"));
        assertThat(text).contains("(int) RS6000_BIF_VADDUWM, BUILT_IN_MD, NULL, NULL_TREE);\n    }\n");
    }

    /**
     * Verifies that instances sharing a name are linked in definition order and only
     * the head of the chain is hashed.
     */
    @Test
    void linksOverloadChains() throws Exception {
        String text = render();

        assertThat(text).contains(String.join("\n",
                "  rs6000_overload_info[RS6000_INST_VADDSWS].bifname = \"vec_adds\";",
                "  rs6000_overload_info[RS6000_INST_VADDSWS].bifid = RS6000_BIF_VADDSWS;",
                "  rs6000_overload_info[RS6000_INST_VADDSWS].ovldid = RS6000_OVLD_VEC_ADDS;",
                "  rs6000_overload_info[RS6000_INST_VADDSWS].fntype = v4si_ftype_v4si_v4si;",
                "  rs6000_overload_info[RS6000_INST_VADDSWS].next = &rs6000_overload_info[RS6000_INST_VADDUWM];",
                "  oaddr = &rs6000_overload_info[RS6000_INST_VADDSWS];"));
        assertThat(text).contains("  rs6000_overload_info[RS6000_INST_VADDUWM].next = NULL;\n\n}");
        assertThat(text).containsOnlyOnce("ovld_hash.find_slot_with_hash");
    }

    /**
     * Verifies that chains follow the external name of the stanza, so instances with
     * different prototype names stay in one chain and stanzas sharing an external name merge.
     */
    @Test
    void chainsOverloadsByExternalName() throws Exception {
        String overloads = String.join("\n",
                "[VEC_ADDS, vec_adds, __builtin_vec_adds]",
                "  vsi __builtin_vec_adds (vsi, vsi);",
                "    VADDSWS",
                "  vui __builtin_vec_addu (vui, vui);",
                "    VADDUWM",
                "[VEC_SPLAT, vec_splat, __builtin_vec_splat]",
                "  vsi __builtin_vec_splat (vsi, int);",
                "    VSPLTW",
                "[VEC_ADDS_F, vec_adds, __builtin_vec_adds]",
                "  _Float128 __builtin_vec_adds (_Float128);",
                "    SQRTF128");
        GeneratorModel model = TestModels.model(BUILTINS, overloads);

        assertThat(model.overloadChains()).containsOnlyKeys("vec_adds", "vec_splat");
        assertThat(model.overloadChains().get("vec_adds"))
                .extracting(OverloadEntry::overloadId)
                .containsExactly("VADDSWS", "VADDUWM", "SQRTF128");

        String text = TestModels.render(new DefinitionsEmitter(), model);
        assertThat(text).contains(
                "  rs6000_overload_info[RS6000_INST_VADDUWM].bifname = \"vec_adds\";",
                "  rs6000_overload_info[RS6000_INST_VADDUWM].next = &rs6000_overload_info[RS6000_INST_SQRTF128];",
                "  rs6000_overload_info[RS6000_INST_SQRTF128].ovldid = RS6000_OVLD_VEC_ADDS_F;",
                "  oslot = ovld_hash.find_slot_with_hash (\"vec_splat\", hash, INSERT);");
        assertThat(text).containsOnlyOnce("find_slot_with_hash (\"vec_adds\"");
        assertThat(text).doesNotContain("__builtin_vec_addu\"");
    }
}
