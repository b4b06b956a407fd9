package org.hexregion.core.topology;

public record WorldPosition(double x, double y, double z) {
}
