package com.animequote.infrastructure.analysis.rules;

import java.util.Set;

/**
 * Case particles that are never vocabulary on their own (は, が, を, に, へ, で, と).
 */
public class ParticleTable {

    private final Set<String> particles;

    public ParticleTable(Set<String> particles) {
        this.particles = Set.copyOf(particles);
    }

    public boolean isParticle(String text) {
        return text != null && particles.contains(text);
    }

    public boolean isParticle(char c) {
        return particles.contains(String.valueOf(c));
    }
}
