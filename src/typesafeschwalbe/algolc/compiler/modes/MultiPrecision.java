package typesafeschwalbe.algolc.compiler.modes;

public interface MultiPrecision {

    // The number of decimal digits a value of the named standard mode
    // holds, or the number of bits for the BITS modes.
    int digits(String mode);

    public static final MultiPrecision DEFAULT = new MultiPrecision() {

        @Override
        public int digits(String mode) {
            switch(mode) {
                case "INT": return 10;
                case "LONG INT": return 19;
                case "LONG LONG INT": return 60;
                case "REAL": return 17;
                case "LONG REAL": return 35;
                case "LONG LONG REAL": return 60;
                case "BITS": return 32;
                case "LONG BITS": return 64;
                case "LONG LONG BITS": return 128;
                case "BYTES": return 32;
                case "LONG BYTES": return 256;
                default: return 0;
            }
        }

    };

}
