package dev.kyriji.bmcnetwork.crd;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

@Group("elbv2.services.k8s.aws")
@Version("v1alpha1")
@Kind("Listener")
@Plural("listeners")
@Singular("listener")
public class Listener extends CustomResource<ListenerSpec, Void> implements Namespaced {
}
