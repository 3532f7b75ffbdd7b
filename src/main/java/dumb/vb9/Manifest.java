package dumb.vb9;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Persisted record of one compile, replaced wholesale by the next.
 */
public record Manifest(
        @JsonProperty("kernels") List<Kernel> kernels,
        @JsonProperty("proof_tree") List<ProofEdge> proofTree,
        @JsonProperty("proof_hash") String proofHash
) {
    public static final String PATH = "/form/manifest.json";

    public Manifest {
        kernels = List.copyOf(kernels);
        proofTree = List.copyOf(proofTree);
    }

    public static Manifest of(List<Kernel> kernels, List<ProofEdge> proofTree) {
        return new Manifest(kernels, proofTree, Canon.digest(Json.compact(proofTree)));
    }
}
