package lib;

public class Base {
    protected int value = 2;
}
