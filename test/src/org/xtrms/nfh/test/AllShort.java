/* @LICENSE@  
 */


package org.xtrms.nfh.test;

import org.xtrms.nfh.NFHReaderTestCase;
import org.xtrms.nfh.NFHTestCase;
import org.xtrms.nfh.RunManagerTestCase;
import org.xtrms.nfh.RunTestCase;
import org.xtrms.nfh.SimulatorTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(NFHTestCase.class);
        suite.addTestSuite(NFHReaderTestCase.class);
        suite.addTestSuite(RunTestCase.class);
        suite.addTestSuite(RunManagerTestCase.class);
        suite.addTestSuite(SimulatorTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
