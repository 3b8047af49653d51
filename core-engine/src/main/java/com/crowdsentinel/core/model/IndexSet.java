package com.crowdsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * The five physical indices and three behavioral sub-indices derived from one
 * {@link RawSample}.
 *
 * <p>
 * Every component is clamped to [0,1] on construction ({@code NaN} becomes
 * 0), so an {@code IndexSet} can never carry an out-of-range value.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "CAI", "CDI", "THI", "TI", "EI", "ATI", "SNI", "PCI" })
public final class IndexSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double cai;
    private final double cdi;
    private final double thi;
    private final double ti;
    private final double ei;
    private final double ati;
    private final double sni;
    private final double pci;

    /**
     * @param cai crowd anxiety index
     * @param cdi crowd dynamics index
     * @param thi temperature-humidity index
     * @param ti  time index
     * @param ei  event index
     * @param ati attitude index
     * @param sni subjective-norm index
     * @param pci perceived-control index
     */
    public IndexSet(double cai, double cdi, double thi, double ti, double ei,
            double ati, double sni, double pci) {
        this.cai = clamp01(cai);
        this.cdi = clamp01(cdi);
        this.thi = clamp01(thi);
        this.ti = clamp01(ti);
        this.ei = clamp01(ei);
        this.ati = clamp01(ati);
        this.sni = clamp01(sni);
        this.pci = clamp01(pci);
    }

    /**
     * Clamp a value into [0,1]; {@code NaN} maps to 0.
     *
     * @param value any double
     * @return the clamped value
     */
    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @JsonProperty("CAI")
    public double getCai() {
        return cai;
    }

    @JsonProperty("CDI")
    public double getCdi() {
        return cdi;
    }

    @JsonProperty("THI")
    public double getThi() {
        return thi;
    }

    @JsonProperty("TI")
    public double getTi() {
        return ti;
    }

    @JsonProperty("EI")
    public double getEi() {
        return ei;
    }

    @JsonProperty("ATI")
    public double getAti() {
        return ati;
    }

    @JsonProperty("SNI")
    public double getSni() {
        return sni;
    }

    @JsonProperty("PCI")
    public double getPci() {
        return pci;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IndexSet that))
            return false;
        return Double.compare(cai, that.cai) == 0
                && Double.compare(cdi, that.cdi) == 0
                && Double.compare(thi, that.thi) == 0
                && Double.compare(ti, that.ti) == 0
                && Double.compare(ei, that.ei) == 0
                && Double.compare(ati, that.ati) == 0
                && Double.compare(sni, that.sni) == 0
                && Double.compare(pci, that.pci) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cai, cdi, thi, ti, ei, ati, sni, pci);
    }

    @Override
    public String toString() {
        return String.format(
                "IndexSet{CAI=%.3f, CDI=%.3f, THI=%.3f, TI=%.3f, EI=%.3f, ATI=%.3f, SNI=%.3f, PCI=%.3f}",
                cai, cdi, thi, ti, ei, ati, sni, pci);
    }
}
