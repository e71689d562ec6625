package com.example.est.tomography;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.ops.transforms.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Iterative EST reconstruction. Starting from the initializer's estimate, each
 * iteration forward-projects the image, compares it with the observed sinogram,
 * backprojects the residual and takes a damped step, clipping negative densities.
 * The loop stops when the max error stops changing by more than the tolerance, or
 * when the iteration budget is spent.
 */
public class ReconstructionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionEngine.class);

    private final ProjectionOperator projector;
    private final BackprojectionOperator backprojector;
    private final ReconstructionInitializer initializer;

    public ReconstructionEngine(ProjectionOperator projector,
                                BackprojectionOperator backprojector,
                                ReconstructionInitializer initializer) {
        this.projector = projector;
        this.backprojector = backprojector;
        this.initializer = initializer;
    }

    public ReconstructionResult reconstruct(INDArray observed, AngleSet angles, ReconstructionSettings settings) {
        return reconstruct(observed, angles, settings, ReconstructionListener.none());
    }

    public ReconstructionResult reconstruct(INDArray observed, AngleSet angles,
                                            ReconstructionSettings settings, ReconstructionListener listener) {
        validate(observed, angles, settings);
        observed = observed.castTo(DataType.DOUBLE);
        int projections = angles.size();
        int detectors = (int) observed.columns();

        SinogramLayout layout = initializer.sinogramLayout();
        INDArray image = initializer.toCanonicalImage(
                initializer.initialize(layout.fromCanonical(observed), angles));
        int side = checkSquare(image);
        image = image.castTo(DataType.DOUBLE);
        if (image.minNumber().doubleValue() < 0) {
            logger.warn("Estimativa inicial contém valores negativos; serão truncados na primeira atualização.");
        }
        logger.debug("Estimativa inicial {}x{} para sinograma {}x{}", side, side, projections, detectors);

        double previousMaxError = Double.POSITIVE_INFINITY;
        List<IterationRecord> trace = new ArrayList<>();

        for (int i = 1; i <= settings.iterations(); i++) {
            INDArray simulated = projector.project(image, angles, detectors);
            INDArray residual = observed.sub(simulated);
            double maxError = Transforms.abs(residual).maxNumber().doubleValue();

            IterationRecord record = new IterationRecord(i, maxError);
            trace.add(record);
            listener.onIteration(record);

            if (Math.abs(previousMaxError - maxError) < settings.tolerance()) {
                logger.debug("Erro estabilizado na iteração {} (erro máximo {})", i, maxError);
                return new ReconstructionResult(image, TerminationReason.CONVERGED, trace);
            }
            previousMaxError = maxError;

            INDArray correction = backprojector.backproject(residual, angles, side);
            double correctionMax = Transforms.abs(correction).maxNumber().doubleValue();
            if (correctionMax != 0) {
                correction = correction.div(correctionMax);
            }

            image = Transforms.relu(image.add(correction.div(projections).mul(settings.learningRate())));
        }

        return new ReconstructionResult(image, TerminationReason.EXHAUSTED, trace);
    }

    private static void validate(INDArray observed, AngleSet angles, ReconstructionSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("Parâmetros de reconstrução ausentes.");
        }
        settings.validate();
        if (observed == null || observed.rank() != 2 || observed.columns() < 1) {
            throw new InvalidConfigurationException("Sinograma observado deve ser uma matriz 2D não vazia.");
        }
        if (angles == null || angles.size() < 2) {
            throw new InvalidConfigurationException("São necessários pelo menos 2 ângulos.");
        }
        if (angles.size() != observed.rows()) {
            throw new InvalidConfigurationException("Quantidade de ângulos (" + angles.size()
                    + ") difere das linhas do sinograma (" + observed.rows() + ")");
        }
    }

    private static int checkSquare(INDArray image) {
        if (image == null || image.rank() != 2) {
            throw new ShapeMismatchException("Estimativa inicial deve ser uma imagem 2D.");
        }
        if (image.rows() != image.columns() || image.rows() < 1) {
            throw new ShapeMismatchException("Estimativa inicial deve ser quadrada, recebido "
                    + image.rows() + "x" + image.columns());
        }
        return (int) image.rows();
    }
}
