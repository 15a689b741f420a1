package org.simprep.pipeline.tasks;

import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.membrane.BilayerSpec;
import org.simprep.pipeline.membrane.EmbedSpec;
import org.simprep.pipeline.tasks.Modifications.Disulfide;
import org.simprep.pipeline.tasks.Modifications.Graft;
import org.simprep.pipeline.tasks.Modifications.Mutation;
import org.simprep.pipeline.tasks.Modifications.ResidueRange;
import org.simprep.pipeline.tasks.Modifications.Site;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Kind-specific parameters of a task, one record per {@link TaskKind}.
 * <p>
 * Instances are fully validated when they are built from configuration, so a task never
 * starts an engine with parameters that could have been rejected up front.
 */
public sealed interface TaskSpec {

    TaskKind kind();

    /**
     * Materializes a source structure, either a local file or an entry of the structure cache.
     *
     * @param id structure identifier, used as the run's basename
     * @param source explicit source file, or null to look {@code id} up in the cache
     */
    record Fetch(String id, Path source) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.FETCH;
        }
    }

    /**
     * Builds connectivity and coordinates from the fetched structure.
     *
     * @param mutations point mutations
     * @param deletions residue ranges removed before building
     * @param disulfides disulfide patches
     * @param grafts glycan grafts, each becoming a new chain
     * @param loops gaps built as open loops that a later ligation closes
     */
    record BuildTopology(List<Mutation> mutations, List<ResidueRange> deletions, List<Disulfide> disulfides,
                         List<Graft> grafts, List<LoopGap> loops) implements TaskSpec {
        public BuildTopology {
            mutations = List.copyOf(mutations);
            deletions = List.copyOf(deletions);
            disulfides = List.copyOf(disulfides);
            grafts = List.copyOf(grafts);
            loops = List.copyOf(loops);
        }

        @Override
        public TaskKind kind() {
            return TaskKind.BUILD_TOPOLOGY;
        }
    }

    /**
     * Closes every pending loop gap by steered dynamics followed by a bond patch.
     *
     * @param steerSteps dynamics steps used to pull the termini together
     * @param forceConstant force constant of the pulling bias in kcal/mol/A^2
     * @param targetDistance final C-N distance in Angstrom
     * @param temperature temperature of the steering run in K
     */
    record Ligate(int steerSteps, double forceConstant, double targetDistance, double temperature) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.LIGATE;
        }
    }

    /**
     * Splits chains after the given residues; the C-terminal fragments get new chain ids.
     */
    record Cleave(List<Site> sites) implements TaskSpec {
        public Cleave {
            sites = List.copyOf(sites);
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CLEAVE;
        }
    }

    /**
     * Exchanges residues {@code first..last} between two chains.
     */
    record DomainSwap(String chainA, String chainB, int first, int last) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.DOMAIN_SWAP;
        }
    }

    /**
     * Rigid-body coordinate transforms.
     *
     * @param orient align the principal axes of the system with the coordinate axes
     * @param center move the center of mass to the origin
     * @param translate displacement applied last, {x, y, z}
     */
    record Manipulate(boolean orient, boolean center, List<Double> translate) implements TaskSpec {
        public Manipulate {
            translate = List.copyOf(translate);
            if (translate.size() != 3) {
                throw new IllegalArgumentException("translate needs three components, got " + translate.size());
            }
        }

        @Override
        public TaskKind kind() {
            return TaskKind.MANIPULATE;
        }
    }

    /**
     * Surrounds the system with water and ions in a periodic box.
     *
     * @param pad water layer around the solute in Angstrom
     * @param cation cation residue name
     * @param anion anion residue name
     * @param saltConcentration salt added beyond neutralization, mol/L
     */
    record Solvate(double pad, String cation, String anion, double saltConcentration) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.SOLVATE;
        }
    }

    /**
     * Strips everything outside {@code keepSelection} and drops the periodic box.
     */
    record Desolvate(String keepSelection) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.DESOLVATE;
        }
    }

    /**
     * Builds a membrane (bilayer patch, relaxation, quilt) and optionally embeds the current
     * structure in it.
     */
    record MakeMembraneSystem(BilayerSpec bilayer) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.MAKE_MEMBRANE_SYSTEM;
        }

        public EmbedSpec embed() {
            return bilayer.embed();
        }
    }

    /**
     * One dynamics stage.
     *
     * @param ensemble protocol to run
     * @param nsteps minimization or dynamics steps
     * @param temperature thermostat temperature in K
     * @param pressure barostat pressure in bar
     * @param timestep integration timestep in fs
     * @param otherParameters extra engine keywords written verbatim
     */
    record RunDynamics(Ensemble ensemble, int nsteps, double temperature, double pressure, double timestep,
                       Map<String, String> otherParameters) implements TaskSpec {
        public RunDynamics {
            otherParameters = Map.copyOf(otherParameters);
            if (nsteps < 1) {
                throw new IllegalArgumentException("nsteps must be positive, got " + nsteps);
            }
        }

        @Override
        public TaskKind kind() {
            return TaskKind.RUN_DYNAMICS;
        }
    }

    /**
     * Collects scalar time series from the logs of preceding dynamics stages.
     *
     * @param traces series to extract: engine energy columns or {@code density}
     */
    record Plot(List<String> traces) implements TaskSpec {
        public Plot {
            traces = List.copyOf(traces);
        }

        @Override
        public TaskKind kind() {
            return TaskKind.PLOT;
        }
    }

    /**
     * Structural checks on the current state.
     *
     * @param minDistance smallest allowed distance between two atoms of one residue
     * @param failOnError abort the run when any check fails
     * @param ringCheck look for bonds threaded through rings of other residues
     * @param ringCutoff largest distance between a ring centre and a bond midpoint that is examined
     */
    record Validate(double minDistance, boolean failOnError, boolean ringCheck, double ringCutoff)
        implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.VALIDATE;
        }
    }

    /**
     * Writes the final system under a chosen basename and bundles it.
     *
     * @param basename basename of the terminal files
     * @param archive also write a zip archive holding the files and a manifest
     */
    record Terminate(String basename, boolean archive) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.PACKAGE;
        }
    }

    /**
     * Hydrates the state from existing files.
     */
    record Restart(Path psf, Path pdb, Path xsc, Path coor, Path vel) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.RESTART;
        }
    }

    /**
     * Hydrates the state of an interrupted dynamics run so it continues where it stopped.
     */
    record Continuation(Path psf, Path pdb, Path xsc, Path coor, Path vel, long firstTimestep) implements TaskSpec {
        @Override
        public TaskKind kind() {
            return TaskKind.CONTINUATION;
        }
    }
}
