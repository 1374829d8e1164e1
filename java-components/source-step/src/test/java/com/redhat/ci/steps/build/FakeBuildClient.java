package com.redhat.ci.steps.build;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.BuildBuilder;
import io.fabric8.openshift.api.model.BuildStatus;
import io.fabric8.openshift.api.model.BuildStatusBuilder;
import io.fabric8.openshift.api.model.ImageStream;
import io.fabric8.openshift.api.model.ImageStreamTag;

/**
 * An in memory cluster. Builds created through it follow a scripted sequence of statuses, one step per read.
 */
public class FakeBuildClient implements BuildClient {

    private final Map<String, Build> builds = new HashMap<>();
    private final Map<String, Deque<BuildStatus>> scripts = new HashMap<>();
    private final Map<String, Integer> pendingDeletions = new HashMap<>();
    private final Map<String, ImageStream> imageStreams = new HashMap<>();
    private final Map<String, ImageStreamTag> imageStreamTags = new HashMap<>();
    private final Map<String, Pod> pods = new HashMap<>();
    private final Map<String, String> logs = new HashMap<>();
    private final List<Event> events = new ArrayList<>();
    private final List<HasMetadata> created = new CopyOnWriteArrayList<>();
    private final Set<Integer> failingGets = new HashSet<>();

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private List<BuildStatus> createScript = List.of(status("New"));
    private int deletionReads;
    private KubernetesClientException createFailure;
    private KubernetesClientException deleteFailure;
    private Consumer<String> beforeCall = call -> {
    };
    private int gets;

    public static BuildStatus status(String phase) {
        return new BuildStatusBuilder().withPhase(phase).build();
    }

    public static BuildStatus failed(String reason, String message, String logSnippet) {
        return new BuildStatusBuilder().withPhase("Failed").withReason(reason).withMessage(message)
                .withLogSnippet(logSnippet).build();
    }

    public static KubernetesClientException apiError(int code, String reason) {
        return new KubernetesClientException(new StatusBuilder().withCode(code).withReason(reason)
                .withMessage(reason).build());
    }

    /**
     * Statuses a build takes after it is created: the first one on creation, then the next one on each read,
     * staying on the last.
     */
    public FakeBuildClient onCreate(BuildStatus... statuses) {
        this.createScript = List.of(statuses);
        return this;
    }

    /**
     * How many reads a deleted build survives before it disappears.
     */
    public FakeBuildClient deletionReads(int reads) {
        this.deletionReads = reads;
        return this;
    }

    public FakeBuildClient failCreateWith(KubernetesClientException e) {
        this.createFailure = e;
        return this;
    }

    public FakeBuildClient failDeleteWith(KubernetesClientException e) {
        this.deleteFailure = e;
        return this;
    }

    /**
     * Makes the n-th build read, counting from 1, fail with a server error.
     */
    public FakeBuildClient failGet(int n) {
        failingGets.add(n);
        return this;
    }

    public FakeBuildClient beforeCall(Consumer<String> hook) {
        this.beforeCall = hook;
        return this;
    }

    public synchronized Build addBuild(Build build, BuildStatus status) {
        Build stored = new BuildBuilder(build)
                .editMetadata()
                .withUid(UUID.randomUUID().toString())
                .withCreationTimestamp("2024-01-01T00:00:00Z")
                .endMetadata()
                .withStatus(status)
                .build();
        builds.put(key(stored.getMetadata().getNamespace(), stored.getMetadata().getName()), stored);
        return stored;
    }

    public synchronized void removeBuild(String namespace, String name) {
        builds.remove(key(namespace, name));
        scripts.remove(key(namespace, name));
    }

    public synchronized void setStatus(String namespace, String name, BuildStatus status) {
        builds.get(key(namespace, name)).setStatus(status);
    }

    public synchronized void addImageStream(ImageStream stream) {
        imageStreams.put(key(stream.getMetadata().getNamespace(), stream.getMetadata().getName()), stream);
    }

    public synchronized void addImageStreamTag(ImageStreamTag tag) {
        imageStreamTags.put(key(tag.getMetadata().getNamespace(), tag.getMetadata().getName()), tag);
    }

    public synchronized void addPod(Pod pod) {
        pods.put(key(pod.getMetadata().getNamespace(), pod.getMetadata().getName()), pod);
    }

    public synchronized void addEvent(Event event) {
        events.add(event);
    }

    public synchronized void setLog(String namespace, String name, String log) {
        logs.put(key(namespace, name), log);
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long count(String call) {
        return calls.stream().filter(call::equals).count();
    }

    public synchronized Build storedBuild(String namespace, String name) {
        return builds.get(key(namespace, name));
    }

    private void record(String call) {
        beforeCall.accept(call);
        calls.add(call);
    }

    @Override
    public Build createBuild(Build build) {
        record("create");
        synchronized (this) {
            if (createFailure != null) {
                throw createFailure;
            }
            String key = key(build.getMetadata().getNamespace(), build.getMetadata().getName());
            if (builds.containsKey(key)) {
                throw apiError(409, KubernetesErrors.REASON_ALREADY_EXISTS);
            }
            Build stored = addBuild(build, createScript.get(0));
            scripts.put(key, new ArrayDeque<>(createScript.subList(1, createScript.size())));
            created.add(stored);
            return stored;
        }
    }

    @Override
    public Build getBuild(String namespace, String name) {
        record("get");
        synchronized (this) {
            if (failingGets.contains(++gets)) {
                throw apiError(500, "InternalError");
            }
            String key = key(namespace, name);
            Integer remaining = pendingDeletions.get(key);
            if (remaining != null) {
                if (remaining <= 0) {
                    pendingDeletions.remove(key);
                    builds.remove(key);
                    scripts.remove(key);
                    return null;
                }
                pendingDeletions.put(key, remaining - 1);
            }
            Build build = builds.get(key);
            if (build == null) {
                return null;
            }
            Deque<BuildStatus> script = scripts.get(key);
            if (script != null && !script.isEmpty() && remaining == null) {
                build.setStatus(script.poll());
            }
            return new BuildBuilder(build).build();
        }
    }

    @Override
    public void deleteBuild(String namespace, String name, String uid) {
        record("delete");
        synchronized (this) {
            String key = key(namespace, name);
            if (deleteFailure != null) {
                builds.remove(key);
                throw deleteFailure;
            }
            Build build = builds.get(key);
            if (build == null) {
                throw apiError(404, "NotFound");
            }
            if (!build.getMetadata().getUid().equals(uid)) {
                throw apiError(409, KubernetesErrors.REASON_CONFLICT);
            }
            if (deletionReads == 0) {
                builds.remove(key);
                scripts.remove(key);
            } else {
                pendingDeletions.put(key, deletionReads);
            }
        }
    }

    @Override
    public synchronized String getBuildLog(String namespace, String name) {
        record("log");
        return logs.getOrDefault(key(namespace, name), "");
    }

    @Override
    public synchronized ImageStream getImageStream(String namespace, String name) {
        record("imagestream");
        return imageStreams.get(key(namespace, name));
    }

    @Override
    public synchronized ImageStreamTag getImageStreamTag(String namespace, String name) {
        record("imagestreamtag");
        return imageStreamTags.get(key(namespace, name));
    }

    @Override
    public synchronized Pod getPod(String namespace, String name) {
        record("pod");
        return pods.get(key(namespace, name));
    }

    @Override
    public synchronized List<Event> listEvents(String namespace, String involvedObjectUid) {
        record("events");
        List<Event> result = new ArrayList<>();
        for (var i : events) {
            if (namespace.equals(i.getMetadata().getNamespace())
                    && involvedObjectUid.equals(i.getInvolvedObject().getUid())) {
                result.add(i);
            }
        }
        return result;
    }

    @Override
    public List<HasMetadata> objects() {
        return List.copyOf(created);
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }
}
