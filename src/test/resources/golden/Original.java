public class Original {
    public static double add_mul(double a, double b) {
        if (a > b) {
            return a * b + 1;
        } else {
            return a + b;
        }
    }
}
