package io.github.eutro.vprep.ops;

public enum ICmpPredicate {
    EQ("eq"),
    NE("ne"),
    SLT("slt"),
    SLE("sle"),
    SGT("sgt"),
    SGE("sge"),
    ULT("ult"),
    ULE("ule"),
    UGT("ugt"),
    UGE("uge"),
    ;

    public final String mnemonic;

    ICmpPredicate(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
