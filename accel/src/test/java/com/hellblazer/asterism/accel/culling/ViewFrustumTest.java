/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Asterism.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.asterism.accel.culling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ViewFrustumTest {

    private ViewFrustum frustum;

    /**
     * Camera at the origin looking down -z, 90° field of view, square aspect: the side planes are the 45° diagonals
     */
    private static CameraState axisCamera(Point3f position) {
        return new CameraState(position, new Vector3f(0, 0, -1), new Vector3f(0, 1, 0), (float) (Math.PI / 2), 1.0f,
                               1.0f, 100.0f);
    }

    @BeforeEach
    void setUp() {
        frustum = ViewFrustum.from(axisCamera(new Point3f()));
    }

    @Test
    @DisplayName("All six planes face into the visible region")
    void testPlaneOrientation() {
        var center = new Point3f(0, 0, -50);
        for (var plane : frustum.getPlanes()) {
            assertTrue(plane.distanceToPoint(center) > 0, "plane faces away from the view axis: " + plane);
            assertEquals(1.0f, plane.getNormal().length(), 1e-5f);
        }
        assertEquals(6, frustum.getPlanes().length);
        assertEquals(new Vector3f(0, 0, -1), frustum.nearPlane.getNormal());
        assertEquals(new Vector3f(0, 0, 1), frustum.farPlane.getNormal());
    }

    @Test
    @DisplayName("Point containment against every plane")
    void testContainsPoint() {
        assertTrue(frustum.containsPoint(new Point3f(0, 0, -10)));
        assertTrue(frustum.containsPoint(new Point3f(9, 0, -10)));
        assertTrue(frustum.containsPoint(new Point3f(0, -9, -10)));
        assertTrue(frustum.containsPoint(new Point3f(-60, 60, -99)));

        assertFalse(frustum.containsPoint(new Point3f(0, 0, 10)), "behind the camera");
        assertFalse(frustum.containsPoint(new Point3f(0, 0, -0.5f)), "before the near plane");
        assertFalse(frustum.containsPoint(new Point3f(0, 0, -150)), "beyond the far plane");
        assertFalse(frustum.containsPoint(new Point3f(11, 0, -10)), "right of the view");
        assertFalse(frustum.containsPoint(new Point3f(-11, 0, -10)), "left of the view");
        assertFalse(frustum.containsPoint(new Point3f(0, 11, -10)), "above the view");
        assertFalse(frustum.containsPoint(new Point3f(0, -11, -10)), "below the view");
    }

    @Test
    @DisplayName("Spheres straddling a plane count as visible")
    void testSpheres() {
        var straddling = new Point3f(11, 0, -10);
        assertTrue(frustum.containsSphere(straddling, 2.0f));
        assertEquals(VisibilityType.INTERSECTING, frustum.classifySphere(straddling, 2.0f));
        assertFalse(frustum.containsSphere(straddling, 0.5f));
        assertEquals(VisibilityType.OUTSIDE, frustum.classifySphere(straddling, 0.5f));

        assertEquals(VisibilityType.INSIDE, frustum.classifySphere(new Point3f(0, 0, -50), 1.0f));
        assertTrue(frustum.containsSphere(new Point3f(0, 0, -50), 0.0f));
    }

    @Test
    @DisplayName("Box tests: conservative intersection and full containment")
    void testBoxes() {
        var insideMin = new Point3f(-1, -1, -11);
        var insideMax = new Point3f(1, 1, -9);
        assertTrue(frustum.intersectsAABB(insideMin, insideMax));
        assertTrue(frustum.containsAABB(insideMin, insideMax));

        var straddleMin = new Point3f(5, -1, -11);
        var straddleMax = new Point3f(15, 1, -9);
        assertTrue(frustum.intersectsAABB(straddleMin, straddleMax));
        assertFalse(frustum.containsAABB(straddleMin, straddleMax));

        var outsideMin = new Point3f(50, 50, -11);
        var outsideMax = new Point3f(60, 60, -9);
        assertFalse(frustum.intersectsAABB(outsideMin, outsideMax));
        assertFalse(frustum.containsAABB(outsideMin, outsideMax));

        assertFalse(frustum.intersectsAABB(new Point3f(-1, -1, 1), new Point3f(1, 1, 5)), "behind the camera");
    }

    @Test
    @DisplayName("Aspect ratio widens the horizontal extent only")
    void testAspect() {
        var wide = ViewFrustum.from(
        new CameraState(new Point3f(), new Vector3f(0, 0, -1), new Vector3f(0, 1, 0), (float) (Math.PI / 2), 2.0f,
                        1.0f, 100.0f));
        assertTrue(wide.containsPoint(new Point3f(19, 0, -10)));
        assertFalse(wide.containsPoint(new Point3f(21, 0, -10)));
        assertFalse(wide.containsPoint(new Point3f(0, 11, -10)));
    }

    @Test
    @DisplayName("Look-at camera sees its target and not what lies behind it")
    void testLookAt() {
        var camera = CameraState.lookAt(new Point3f(100, 100, 100), new Point3f(200, 200, 200),
                                        new Vector3f(0, 1, 0), (float) Math.toRadians(60.0), 1.5f, 10.0f, 1000.0f);
        var lookAt = ViewFrustum.from(camera);
        assertTrue(lookAt.containsPoint(new Point3f(200, 200, 200)));
        assertTrue(lookAt.containsPoint(new Point3f(300, 300, 300)));
        assertFalse(lookAt.containsPoint(new Point3f(0, 0, 0)));
        assertFalse(lookAt.containsPoint(new Point3f(100, 100, 100)), "the eye is before the near plane");
        assertSame(camera, lookAt.camera());
    }

    @Test
    @DisplayName("Containment is invariant under translating camera and point together")
    void testTranslationInvariance() {
        var random = new Random(17);
        var offset = new Vector3f(1234.5f, -876.25f, 310.0f);
        var moved = ViewFrustum.from(axisCamera(new Point3f(offset)));

        int compared = 0;
        for (int i = 0; i < 2000; i++) {
            var p = new Point3f(random.nextFloat() * 240 - 120, random.nextFloat() * 240 - 120,
                                random.nextFloat() * -120 + 10);
            if (nearBoundary(p)) {
                continue;
            }
            var q = new Point3f(p);
            q.add(offset);
            assertEquals(frustum.containsPoint(p), moved.containsPoint(q), "point " + p);
            compared++;
        }
        assertTrue(compared > 1000);
    }

    private boolean nearBoundary(Point3f p) {
        for (var plane : frustum.getPlanes()) {
            if (Math.abs(plane.distanceToPoint(p)) < 0.05f) {
                return true;
            }
        }
        return false;
    }
}
