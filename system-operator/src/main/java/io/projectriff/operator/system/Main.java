/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.projectriff.api.model.build.Container;
import io.projectriff.api.model.build.ContainerList;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.build.FunctionBuildList;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.DeployerList;
import io.projectriff.api.model.streaming.Processor;
import io.projectriff.api.model.streaming.ProcessorList;
import io.projectriff.api.model.thirdparty.knative.build.Build;
import io.projectriff.api.model.thirdparty.knative.build.BuildList;
import io.projectriff.api.model.thirdparty.knative.serving.Configuration;
import io.projectriff.api.model.thirdparty.knative.serving.ConfigurationList;
import io.projectriff.api.model.thirdparty.knative.serving.Route;
import io.projectriff.api.model.thirdparty.knative.serving.RouteList;
import io.projectriff.operator.common.MetricsProvider;
import io.projectriff.operator.common.MicrometerMetricsProvider;
import io.projectriff.operator.common.OperatorKubernetesClientBuilder;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.controller.Controller;
import io.projectriff.operator.common.controller.ControllerOptions;
import io.projectriff.operator.common.controller.ReferenceTracker;
import io.projectriff.operator.common.digest.ImagePullSecretCredentialsProvider;
import io.projectriff.operator.common.digest.RegistryDigestResolver;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.events.KubernetesEventRecorder;
import io.projectriff.operator.common.http.HealthCheckAndMetricsServer;
import io.projectriff.operator.common.operator.resource.CrdOperator;
import io.projectriff.operator.common.operator.resource.DeploymentOperator;
import io.projectriff.operator.common.operator.resource.PvcOperator;
import io.projectriff.operator.common.operator.resource.SecretOperator;
import io.projectriff.operator.common.operator.resource.ServiceAccountOperator;
import io.projectriff.operator.common.reconciler.ImageResolutionStep;
import io.projectriff.operator.system.build.ContainerReconciler;
import io.projectriff.operator.system.build.FunctionBuildReconciler;
import io.projectriff.operator.system.knative.DeployerReconciler;
import io.projectriff.operator.system.streaming.ProcessorReconciler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.Security;
import java.util.ArrayList;
import java.util.List;

/**
 * The main class of the riff System Operator
 */
@SuppressWarnings("checkstyle:classdataabstractioncoupling")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    /**
     * Main method which starts the webserver with healthchecks and metrics and the controllers of the riff resources
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("SystemOperator {} is starting", version);

        // Log environment information
        Util.printEnvInfo();

        SystemOperatorConfig config = SystemOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("SystemOperator configuration is {}", config);

        // Disable DNS caching
        Security.setProperty("networkaddress.cache.ttl", String.valueOf(config.getDnsCacheTtl()));

        KubernetesClient client = new OperatorKubernetesClientBuilder("riff-system-operator", version).build();
        MetricsProvider metricsProvider = createMetricsProvider();

        List<Controller<?>> controllers = createControllers(client, config, metricsProvider);
        OperatorHealth health = new OperatorHealth(controllers);

        HealthCheckAndMetricsServer healthCheckAndMetricsServer = new HealthCheckAndMetricsServer(health, health, metricsProvider);
        healthCheckAndMetricsServer.start();
        controllers.forEach(Controller::start);

        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Requesting controllers to stop");
            controllers.forEach(Controller::stop);

            LOGGER.info("Requesting health check and metrics server to stop");
            healthCheckAndMetricsServer.stop();

            LOGGER.info("Requesting Kubernetes client to stop");
            client.close();

            LOGGER.info("Shutdown complete");
        }));
    }

    /**
     * Creates one controller per watched namespace and owner kind
     *
     * @param client            Kubernetes client
     * @param config            Operator configuration
     * @param metricsProvider   Metrics provider
     *
     * @return  Controllers which are not started yet
     */
    /* test */ static List<Controller<?>> createControllers(KubernetesClient client, SystemOperatorConfig config, MetricsProvider metricsProvider) {
        var functionBuildOperator = new CrdOperator<>(client, FunctionBuild.class, FunctionBuildList.class, FunctionBuild.RESOURCE_KIND);
        var containerOperator = new CrdOperator<>(client, Container.class, ContainerList.class, Container.RESOURCE_KIND);
        var deployerOperator = new CrdOperator<>(client, Deployer.class, DeployerList.class, Deployer.RESOURCE_KIND);
        var processorOperator = new CrdOperator<>(client, Processor.class, ProcessorList.class, Processor.RESOURCE_KIND);
        var buildOperator = new CrdOperator<>(client, Build.class, BuildList.class, Build.RESOURCE_KIND);
        var configurationOperator = new CrdOperator<>(client, Configuration.class, ConfigurationList.class, Configuration.RESOURCE_KIND);
        var routeOperator = new CrdOperator<>(client, Route.class, RouteList.class, Route.RESOURCE_KIND);
        PvcOperator pvcOperator = new PvcOperator(client);
        DeploymentOperator deploymentOperator = new DeploymentOperator(client);

        EventRecorder eventRecorder = new KubernetesEventRecorder(client, "riff-system-operator");

        RegistryDigestResolver digestResolver = new RegistryDigestResolver(
                new ImagePullSecretCredentialsProvider(new ServiceAccountOperator(client), new SecretOperator(client)),
                config.getInsecureRegistries(),
                config.getRegistryTimeout());
        ImageResolutionStep imageResolution = new ImageResolutionStep(digestResolver, config.getSkipRegistries());

        ReferenceTracker deployerReferences = new ReferenceTracker();
        ReferenceTracker processorReferences = new ReferenceTracker();

        FunctionBuildReconciler functionBuildReconciler = new FunctionBuildReconciler(functionBuildOperator, pvcOperator, buildOperator,
                imageResolution, eventRecorder, config.getBuildServiceAccount(), config.getBuildTemplate());
        ContainerReconciler containerReconciler = new ContainerReconciler(containerOperator, imageResolution, eventRecorder);
        DeployerReconciler deployerReconciler = new DeployerReconciler(deployerOperator, functionBuildOperator, containerOperator,
                configurationOperator, routeOperator, deployerReferences, eventRecorder);
        ProcessorReconciler processorReconciler = new ProcessorReconciler(processorOperator, functionBuildOperator, deploymentOperator,
                processorReferences, eventRecorder, config.getProcessorImage());

        List<Controller<?>> controllers = new ArrayList<>();

        for (String namespace : config.getNamespaces()) {
            ControllerOptions options = new ControllerOptions(namespace, config.getLabels(), config.getWorkQueueSize(),
                    config.getControllerThreadPoolSize(), config.getReconciliationIntervalMs());

            Controller<FunctionBuild> functionBuildController = new Controller<>(functionBuildOperator, functionBuildReconciler, options, metricsProvider);
            functionBuildController.watchControlledChildren(pvcOperator);
            functionBuildController.watchControlledChildren(buildOperator);
            controllers.add(functionBuildController);

            controllers.add(new Controller<>(containerOperator, containerReconciler, options, metricsProvider));

            Controller<Deployer> deployerController = new Controller<>(deployerOperator, deployerReconciler, options, metricsProvider);
            deployerController.watchControlledChildren(configurationOperator);
            deployerController.watchControlledChildren(routeOperator);
            deployerController.watchReferences(functionBuildOperator, deployerReferences);
            deployerController.watchReferences(containerOperator, deployerReferences);
            controllers.add(deployerController);

            Controller<Processor> processorController = new Controller<>(processorOperator, processorReconciler, options, metricsProvider);
            processorController.watchControlledChildren(deploymentOperator);
            processorController.watchReferences(functionBuildOperator, processorReferences);
            controllers.add(processorController);
        }

        return controllers;
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }
}
