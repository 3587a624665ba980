package com.hypothesis.annotation;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * GO annotation evidence codes and their descriptions.
 */
public final class EvidenceCodes {

    private static final Map<String, String> DESCRIPTIONS = ImmutableMap.<String, String>builder()
        .put("EXP", "Inferred from Experiment")
        .put("IDA", "Inferred from Direct Assay")
        .put("IPI", "Inferred from Physical Interaction")
        .put("IMP", "Inferred from Mutant Phenotype")
        .put("IGI", "Inferred from Genetic Interaction")
        .put("IEP", "Inferred from Expression Pattern")
        .put("ISS", "Inferred from Sequence or Structural Similarity")
        .put("ISO", "Inferred from Sequence Orthology")
        .put("ISA", "Inferred from Sequence Alignment")
        .put("ISM", "Inferred from Sequence Model")
        .put("IGC", "Inferred from Genomic Context")
        .put("IBA", "Inferred from Biological aspect of Ancestor")
        .put("IBD", "Inferred from Biological aspect of Descendant")
        .put("IKR", "Inferred from Key Residues")
        .put("IRD", "Inferred from Rapid Divergence")
        .put("RCA", "Inferred from Reviewed Computational Analysis")
        .put("TAS", "Traceable Author Statement")
        .put("NAS", "Non-traceable Author Statement")
        .put("IC", "Inferred by Curator")
        .put("ND", "No biological Data available")
        .put("IEA", "Inferred from Electronic Annotation")
        .put("NR", "Not Recorded")
        .build();

    private EvidenceCodes() {
    }

    /**
     * Description of a code, or an empty string for codes outside the GO list.
     */
    public static String describe(String code) {
        if (code == null) {
            return "";
        }
        return DESCRIPTIONS.getOrDefault(code.trim(), "");
    }

    public static Map<String, String> all() {
        return DESCRIPTIONS;
    }
}
