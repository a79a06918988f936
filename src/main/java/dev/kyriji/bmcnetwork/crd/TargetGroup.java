package dev.kyriji.bmcnetwork.crd;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * AWS controllers for Kubernetes (ACK) target group. The ACK controller creates the cloud resource and
 * reports its ARN in the status.
 */
@Group("elbv2.services.k8s.aws")
@Version("v1alpha1")
@Kind("TargetGroup")
@Plural("targetgroups")
@Singular("targetgroup")
public class TargetGroup extends CustomResource<TargetGroupSpec, TargetGroupStatus> implements Namespaced {
}
