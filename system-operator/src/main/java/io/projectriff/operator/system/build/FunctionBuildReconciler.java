/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.build;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.build.FunctionBuildStatus;
import io.projectriff.api.model.thirdparty.knative.build.Build;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.digest.RegistryAuthContext;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.model.ConditionManager;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.operator.resource.ResourceOperator;
import io.projectriff.operator.common.reconciler.AbstractOwnerReconciler;
import io.projectriff.operator.common.reconciler.ChildSynchronizer;
import io.projectriff.operator.common.reconciler.ImageResolutionStep;

/**
 * Reconciles function builds: the optional build cache volume claim first, then the Knative build. Once both are
 * ready, the built image is resolved to a digest and published as the latest image.
 */
public class FunctionBuildReconciler extends AbstractOwnerReconciler<FunctionBuild, FunctionBuildStatus> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(FunctionBuildReconciler.class);

    /**
     * Conditions of function builds
     */
    public static final ConditionSet CONDITIONS = ConditionSet.living(FunctionBuild.CONDITION_BUILD_CACHE_READY, FunctionBuild.CONDITION_BUILD_SUCCEEDED);

    /* test */ static final String REASON_NOT_USED = "NotUsed";

    private final ChildSynchronizer<FunctionBuild, PersistentVolumeClaim> buildCacheSynchronizer;
    private final ChildSynchronizer<FunctionBuild, Build> buildSynchronizer;
    private final ImageResolutionStep imageResolution;

    /**
     * Constructor
     *
     * @param functionBuildOperator Operator for the function builds
     * @param pvcOperator           Operator for the persistent volume claims
     * @param buildOperator         Operator for the Knative builds
     * @param imageResolution       Image resolution
     * @param eventRecorder         Recorder for the events
     * @param buildServiceAccount   Service account of the builds
     * @param buildTemplate         Cluster build template of the builds
     */
    public FunctionBuildReconciler(ResourceOperator<FunctionBuild> functionBuildOperator,
                                   ResourceOperator<PersistentVolumeClaim> pvcOperator,
                                   ResourceOperator<Build> buildOperator,
                                   ImageResolutionStep imageResolution,
                                   EventRecorder eventRecorder,
                                   String buildServiceAccount,
                                   String buildTemplate) {
        super(FunctionBuild.RESOURCE_KIND, functionBuildOperator, eventRecorder, CONDITIONS);
        this.buildCacheSynchronizer = new ChildSynchronizer<>(pvcOperator, new BuildCacheDefinition(), eventRecorder);
        this.buildSynchronizer = new ChildSynchronizer<>(buildOperator, new BuildDefinition(buildServiceAccount, buildTemplate), eventRecorder);
        this.imageResolution = imageResolution;
    }

    @Override
    protected FunctionBuildStatus newStatus() {
        return new FunctionBuildStatus();
    }

    @Override
    protected boolean reconcileChildren(Reconciliation reconciliation, FunctionBuild functionBuild, ConditionManager conditions) throws ReconciliationException {
        FunctionBuildStatus status = functionBuild.getStatus();

        if (functionBuild.getSpec() == null || functionBuild.getSpec().getImage() == null) {
            throw new ReconciliationException("FunctionBuild " + reconciliation.key() + " does not specify the image to build");
        }

        PersistentVolumeClaim buildCache = synchronize(buildCacheSynchronizer, reconciliation, functionBuild, conditions, FunctionBuild.CONDITION_BUILD_CACHE_READY);

        if (buildCache == null) {
            status.setBuildCacheName(null);
            conditions.markTrueWithReason(FunctionBuild.CONDITION_BUILD_CACHE_READY, REASON_NOT_USED);
        } else {
            status.setBuildCacheName(buildCache.getMetadata().getName());
            propagateBuildCacheStatus(buildCache, conditions);
        }

        Build build = synchronize(buildSynchronizer, reconciliation, functionBuild, conditions, FunctionBuild.CONDITION_BUILD_SUCCEEDED);
        if (build == null) {
            LOGGER.debugCr(reconciliation, "Build of {} was created concurrently and is not visible yet", reconciliation.key());
            return false;
        }

        status.setBuildName(build.getMetadata().getName());
        if (build.getStatus() != null) {
            conditions.propagate(FunctionBuild.CONDITION_BUILD_SUCCEEDED, build.getStatus().getCondition(Build.CONDITION_SUCCEEDED));
        }

        if (conditions.isReady()) {
            RegistryAuthContext authContext = new RegistryAuthContext(functionBuild.getMetadata().getNamespace(), build.getSpec().getServiceAccountName());
            status.setLatestImage(imageResolution.resolve(reconciliation, functionBuild.getSpec().getImage(), authContext,
                    conditions, FunctionBuild.CONDITION_BUILD_SUCCEEDED));
        }

        return true;
    }

    private static void propagateBuildCacheStatus(PersistentVolumeClaim buildCache, ConditionManager conditions) {
        String phase = buildCache.getStatus() != null ? buildCache.getStatus().getPhase() : null;

        if ("Bound".equals(phase)) {
            conditions.markTrue(FunctionBuild.CONDITION_BUILD_CACHE_READY);
        } else if ("Lost".equals(phase)) {
            conditions.markFalse(FunctionBuild.CONDITION_BUILD_CACHE_READY, "Lost", "Build cache volume claim %s lost its volume", buildCache.getMetadata().getName());
        } else {
            conditions.markUnknown(FunctionBuild.CONDITION_BUILD_CACHE_READY, phase, null);
        }
    }
}
